package com.rtcc.orchestrator.core.model;

import java.util.Map;

/**
 * WGS84 point.
 */
public record GeoLocation(double latitude, double longitude) {

    private static final double EARTH_RADIUS_KM = 6371.0088;

    public GeoLocation {
        if (latitude < -90 || latitude > 90) {
            throw new IllegalArgumentException("Latitude out of range: " + latitude);
        }
        if (longitude < -180 || longitude > 180) {
            throw new IllegalArgumentException("Longitude out of range: " + longitude);
        }
    }

    public static GeoLocation of(double latitude, double longitude) {
        return new GeoLocation(latitude, longitude);
    }

    /**
     * Great-circle distance in kilometres (haversine).
     */
    public double distanceKm(GeoLocation other) {
        double dLat = Math.toRadians(other.latitude - latitude);
        double dLng = Math.toRadians(other.longitude - longitude);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
            + Math.cos(Math.toRadians(latitude)) * Math.cos(Math.toRadians(other.latitude))
            * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        return 2 * EARTH_RADIUS_KM * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    }

    /**
     * Read a location from a loosely shaped raw value: a map with
     * lat/latitude and lng/lon/longitude keys. Returns null if absent or malformed.
     */
    public static GeoLocation fromRaw(Object raw) {
        if (!(raw instanceof Map<?, ?> map)) {
            return null;
        }
        Double lat = number(map, "lat", "latitude");
        Double lng = number(map, "lng", "lon", "longitude");
        if (lat == null || lng == null) {
            return null;
        }
        try {
            return new GeoLocation(lat, lng);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static Double number(Map<?, ?> map, String... keys) {
        for (String key : keys) {
            Object value = map.get(key);
            if (value instanceof Number n) {
                return n.doubleValue();
            }
            if (value instanceof String s) {
                try {
                    return Double.parseDouble(s.trim());
                } catch (NumberFormatException ignored) {
                    return null;
                }
            }
        }
        return null;
    }
}
