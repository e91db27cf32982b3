package com.airsentinel.harmonizer.normalize;

public record CoverageBox(double minLat, double maxLat, double minLon, double maxLon) {
    public CoverageBox {
        if (minLat < -90.0 || maxLat > 90.0 || minLat >= maxLat) {
            throw new IllegalArgumentException("Invalid latitude range: " + minLat + " .. " + maxLat);
        }
        if (minLon < -180.0 || maxLon > 180.0 || minLon >= maxLon) {
            throw new IllegalArgumentException("Invalid longitude range: " + minLon + " .. " + maxLon);
        }
    }

    public static CoverageBox defaults() {
        return new CoverageBox(-70.0, 70.0, -180.0, 180.0);
    }

    public boolean contains(double lat, double lon) {
        return lat >= minLat && lat <= maxLat && lon >= minLon && lon <= maxLon;
    }
}
