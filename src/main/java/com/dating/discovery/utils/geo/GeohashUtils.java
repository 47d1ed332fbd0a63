package com.dating.discovery.utils.geo;

import java.util.Locale;
import java.util.Map;

/**
 * Base32 geohash encoding. Decoding yields the center of the cell, so two points sharing a full
 * hash decode to the same coordinates.
 */
public final class GeohashUtils {
    public static final int DEFAULT_PRECISION = 5;
    private static final String BASE32 = "0123456789bcdefghjkmnpqrstuvwxyz";
    private static final int MAX_PRECISION = 12;

    private static final Map<Integer, String> CELL_SIZE = Map.of(
            1, "~2500km",
            2, "~630km",
            3, "~78km",
            4, "~20km",
            5, "~5km",
            6, "~1.2km",
            7, "~150m",
            8, "~38m"
    );

    private GeohashUtils() {
        throw new UnsupportedOperationException("Not supported");
    }

    public static String encode(double latitude, double longitude) {
        return encode(latitude, longitude, DEFAULT_PRECISION);
    }

    public static String encode(double latitude, double longitude, int precision) {
        validateCoordinates(latitude, longitude);
        if (precision < 1 || precision > MAX_PRECISION) {
            throw new IllegalArgumentException("Geohash precision must be between 1 and " + MAX_PRECISION);
        }

        double latMin = -90.0, latMax = 90.0;
        double lonMin = -180.0, lonMax = 180.0;
        StringBuilder hash = new StringBuilder(precision);
        boolean evenBit = true;
        int bits = 0;
        int bitCount = 0;

        while (hash.length() < precision) {
            if (evenBit) {
                double mid = (lonMin + lonMax) / 2;
                if (longitude > mid) {
                    bits |= 1 << (4 - bitCount);
                    lonMin = mid;
                } else {
                    lonMax = mid;
                }
            } else {
                double mid = (latMin + latMax) / 2;
                if (latitude > mid) {
                    bits |= 1 << (4 - bitCount);
                    latMin = mid;
                } else {
                    latMax = mid;
                }
            }
            evenBit = !evenBit;
            if (++bitCount == 5) {
                hash.append(BASE32.charAt(bits));
                bits = 0;
                bitCount = 0;
            }
        }
        return hash.toString();
    }

    /**
     * Decodes a geohash to the center point of its cell.
     *
     * @throws IllegalArgumentException if the hash is blank or contains a character outside the alphabet
     */
    public static GeoPoint decode(String geohash) {
        if (geohash == null || geohash.isBlank()) {
            throw new IllegalArgumentException("Geohash must not be blank");
        }
        double latMin = -90.0, latMax = 90.0;
        double lonMin = -180.0, lonMax = 180.0;
        boolean evenBit = true;

        for (char c : geohash.trim().toLowerCase(Locale.ROOT).toCharArray()) {
            int value = BASE32.indexOf(c);
            if (value < 0) {
                throw new IllegalArgumentException("Invalid geohash character '" + c + "' in " + geohash);
            }
            for (int mask = 16; mask > 0; mask >>= 1) {
                boolean set = (value & mask) != 0;
                if (evenBit) {
                    double mid = (lonMin + lonMax) / 2;
                    if (set) lonMin = mid; else lonMax = mid;
                } else {
                    double mid = (latMin + latMax) / 2;
                    if (set) latMin = mid; else latMax = mid;
                }
                evenBit = !evenBit;
            }
        }
        return new GeoPoint((latMin + latMax) / 2, (lonMin + lonMax) / 2);
    }

    public static String cellSize(int precision) {
        return CELL_SIZE.getOrDefault(precision, "Unknown");
    }

    public static void validateCoordinates(double latitude, double longitude) {
        if (Double.isNaN(latitude) || latitude < -90 || latitude > 90) {
            throw new IllegalArgumentException("Latitude must be between -90 and 90");
        }
        if (Double.isNaN(longitude) || longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException("Longitude must be between -180 and 180");
        }
    }
}
