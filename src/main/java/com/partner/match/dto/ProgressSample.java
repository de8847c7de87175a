package com.partner.match.dto;

import lombok.Value;

import java.time.LocalDate;

@Value
public class ProgressSample {
    LocalDate date;
    double hours;
}
