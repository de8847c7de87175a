package com.partner.match.dto.enums;

public enum GroupSize {
    ONE_ON_ONE,
    SMALL_GROUP,
    LARGE_GROUP
}
