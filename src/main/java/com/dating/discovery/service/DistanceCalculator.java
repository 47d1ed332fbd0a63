package com.dating.discovery.service;

import com.dating.discovery.dto.DistanceView;
import com.dating.discovery.models.Profile;
import com.dating.discovery.utils.geo.GeoPoint;
import com.dating.discovery.utils.geo.GeohashUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;

/**
 * Great-circle distance between geohash cell centers. Raw values are used for filtering; only
 * {@link #display} rounds.
 */
@Slf4j
@Component
public class DistanceCalculator {
    static final double EARTH_RADIUS_KM = 6371.0088;

    /**
     * @return distance in km, or empty when either location is missing or unreadable
     */
    public OptionalDouble distanceKm(Profile a, Profile b) {
        return distanceKm(a.getGeohash(), b.getGeohash());
    }

    public OptionalDouble distanceKm(String geohashA, String geohashB) {
        if (StringUtils.isBlank(geohashA) || StringUtils.isBlank(geohashB)) {
            return OptionalDouble.empty();
        }
        // canonical argument order
        boolean swap = geohashA.compareTo(geohashB) > 0;
        String first = swap ? geohashB : geohashA;
        String second = swap ? geohashA : geohashB;
        try {
            return OptionalDouble.of(haversineKm(GeohashUtils.decode(first), GeohashUtils.decode(second)));
        } catch (IllegalArgumentException e) {
            log.warn("Unreadable geohash pair ({}, {}): {}", geohashA, geohashB, e.getMessage());
            return OptionalDouble.empty();
        }
    }

    public static double haversineKm(GeoPoint from, GeoPoint to) {
        double lat1 = Math.toRadians(from.latitude());
        double lat2 = Math.toRadians(to.latitude());
        double dLat = lat2 - lat1;
        double dLon = Math.toRadians(to.longitude() - from.longitude());

        double h = Math.pow(Math.sin(dLat / 2), 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.pow(Math.sin(dLon / 2), 2);
        return 2 * EARTH_RADIUS_KM * Math.asin(Math.min(1.0, Math.sqrt(h)));
    }

    /** Unknown distance never excludes a candidate. */
    public boolean withinRange(OptionalDouble distanceKm, int maxDistanceKm) {
        return distanceKm.isEmpty() || distanceKm.getAsDouble() <= maxDistanceKm;
    }

    /**
     * Privacy-preserving display value: whole kilometres rounded up, at least 1.
     */
    public DistanceView display(OptionalDouble distanceKm, boolean hidden) {
        if (hidden) {
            return DistanceView.hidden();
        }
        if (distanceKm.isEmpty()) {
            return DistanceView.unknown();
        }
        return DistanceView.ofKm((int) Math.max(1, Math.ceil(distanceKm.getAsDouble())));
    }
}
