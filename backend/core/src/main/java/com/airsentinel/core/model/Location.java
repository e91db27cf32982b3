package com.airsentinel.core.model;

public record Location(double lat, double lon) {
    private static final double EARTH_RADIUS_KM = 6371.0088;

    public Location {
        if (!Double.isFinite(lat) || lat < -90.0 || lat > 90.0) {
            throw new IllegalArgumentException("Latitude must be within [-90, 90]: " + lat);
        }
        if (!Double.isFinite(lon) || lon < -180.0 || lon > 180.0) {
            throw new IllegalArgumentException("Longitude must be within [-180, 180]: " + lon);
        }
    }

    public static boolean isValid(double lat, double lon) {
        return Double.isFinite(lat) && lat >= -90.0 && lat <= 90.0
                && Double.isFinite(lon) && lon >= -180.0 && lon <= 180.0;
    }

    public double distanceKm(Location other) {
        double dLat = Math.toRadians(other.lat - lat);
        double dLon = Math.toRadians(other.lon - lon);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat)) * Math.cos(Math.toRadians(other.lat))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return 2 * EARTH_RADIUS_KM * Math.asin(Math.min(1.0, Math.sqrt(a)));
    }
}
