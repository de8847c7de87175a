package com.partner.match.dto;

import lombok.Value;

import java.time.LocalDate;

@Value
public class ProgressGoal {
    double targetHours;
    LocalDate deadline;
}
