package com.partner.match.dto.enums;

public enum SessionType {
    VIRTUAL,
    IN_PERSON,
    HYBRID
}
