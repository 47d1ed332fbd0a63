package com.dating.discovery.dto;

import com.dating.discovery.dto.enums.GenderPreference;
import lombok.Builder;

/**
 * Fully resolved discovery settings; every field carries a value.
 */
@Builder(toBuilder = true)
public record DiscoverySettings(
        long userId,
        int minAge,
        int maxAge,
        int maxDistanceKm,
        GenderPreference preferredGender,
        boolean hideDistance,
        boolean hideAge
) {
    public boolean admitsAge(int age) {
        return age >= minAge && age <= maxAge;
    }
}
