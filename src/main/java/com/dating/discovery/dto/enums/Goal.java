package com.dating.discovery.dto.enums;

public enum Goal {
    FRIENDSHIP,
    DATING,
    RELATIONSHIP,
    NETWORKING,
    SERIOUS,
    CASUAL
}
