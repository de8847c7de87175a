package com.partner.match.dto.enums;

public enum LearningStyle {
    VISUAL,
    AUDITORY,
    READING,
    KINESTHETIC
}
