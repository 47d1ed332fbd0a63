package com.dating.discovery.dto;

public record DistanceView(Integer km, String label) {
    public static final String HIDDEN = "hidden";
    public static final String UNKNOWN = "unknown";

    public static DistanceView hidden() {
        return new DistanceView(null, HIDDEN);
    }

    public static DistanceView unknown() {
        return new DistanceView(null, UNKNOWN);
    }

    public static DistanceView ofKm(int km) {
        return new DistanceView(km, km + " km");
    }
}
