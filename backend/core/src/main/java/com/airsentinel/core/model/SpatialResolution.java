package com.airsentinel.core.model;

public record SpatialResolution(Kind kind, double latExtentDeg, double lonExtentDeg) {
    private static final SpatialResolution POINT = new SpatialResolution(Kind.POINT, 0.0, 0.0);
    private static final double EDGE_EPSILON_DEG = 1e-9;

    public enum Kind {
        POINT,
        CELL
    }

    public SpatialResolution {
        if (kind == null) {
            throw new IllegalArgumentException("kind is required");
        }
        if (kind == Kind.POINT && (latExtentDeg != 0.0 || lonExtentDeg != 0.0)) {
            throw new IllegalArgumentException("A point has no extent");
        }
        if (kind == Kind.CELL && !(latExtentDeg > 0.0 && lonExtentDeg > 0.0)) {
            throw new IllegalArgumentException("Cell extents must be positive");
        }
    }

    public static SpatialResolution point() {
        return POINT;
    }

    public static SpatialResolution cell(double latExtentDeg, double lonExtentDeg) {
        return new SpatialResolution(Kind.CELL, latExtentDeg, lonExtentDeg);
    }

    public boolean isCell() {
        return kind == Kind.CELL;
    }

    public double areaDeg2() {
        return latExtentDeg * lonExtentDeg;
    }

    // Edges count as inside; a point only covers its own coordinates.
    public boolean covers(Location center, Location target) {
        if (kind == Kind.POINT) {
            return center.equals(target);
        }
        double dLat = Math.abs(target.lat() - center.lat());
        double dLon = Math.abs(target.lon() - center.lon());
        if (dLon > 180.0) {
            dLon = 360.0 - dLon;
        }
        return dLat <= latExtentDeg / 2 + EDGE_EPSILON_DEG && dLon <= lonExtentDeg / 2 + EDGE_EPSILON_DEG;
    }
}
