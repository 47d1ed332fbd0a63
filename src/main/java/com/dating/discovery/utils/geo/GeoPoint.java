package com.dating.discovery.utils.geo;

public record GeoPoint(double latitude, double longitude) {
}
