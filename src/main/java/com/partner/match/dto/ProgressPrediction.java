package com.partner.match.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class ProgressPrediction {
    LocalDate estimatedCompletion;
    double confidence;
    double currentRate;
    double requiredRate;
}
