package com.partner.match.dto.enums;

public enum RecommendationMethod {
    COLLABORATIVE,
    CONTENT,
    HYBRID
}
