package com.partner.match.dto.enums;

public enum StudyIntensity {
    RELAXED,
    MODERATE,
    INTENSIVE
}
