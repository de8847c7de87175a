package com.partner.match.dto.enums;

public enum CommunicationStyle {
    FORMAL,
    CASUAL,
    MIXED
}
