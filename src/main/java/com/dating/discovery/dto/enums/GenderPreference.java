package com.dating.discovery.dto.enums;

import java.util.EnumSet;
import java.util.Set;

public enum GenderPreference {
    MALE(Gender.MALE),
    FEMALE(Gender.FEMALE),
    OTHER(Gender.OTHER),
    ANY(null);

    private final Gender gender;

    GenderPreference(Gender gender) {
        this.gender = gender;
    }

    public boolean admits(Gender candidate) {
        if (this == ANY) {
            return true;
        }
        return candidate != null && candidate == gender;
    }

    public Set<Gender> admittedGenders() {
        return this == ANY ? EnumSet.allOf(Gender.class) : EnumSet.of(gender);
    }
}
