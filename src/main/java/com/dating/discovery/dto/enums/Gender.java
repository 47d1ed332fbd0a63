package com.dating.discovery.dto.enums;

public enum Gender {
    MALE,
    FEMALE,
    OTHER
}
