package com.airsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

public record Measurement(
        SourceKind source,
        Pollutant pollutant,
        double value,
        Unit unit,
        Location location,
        Instant timestamp,
        SpatialResolution resolution
) {
    public Measurement {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(pollutant, "pollutant is required");
        Objects.requireNonNull(unit, "unit is required");
        Objects.requireNonNull(location, "location is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(resolution, "resolution is required");
        if (!Double.isFinite(value) || value < 0.0) {
            throw new IllegalArgumentException("Measurement value must be finite and >= 0: " + value);
        }
        if (!unit.canonical()) {
            throw new IllegalArgumentException("Measurement unit must be canonical: " + unit.symbol());
        }
        if (source == SourceKind.GROUND && resolution.isCell()) {
            throw new IllegalArgumentException("Ground measurements are point observations");
        }
        if (source == SourceKind.SATELLITE && !resolution.isCell()) {
            throw new IllegalArgumentException("Satellite measurements attach to a grid cell");
        }
    }

    public boolean covers(Location target) {
        return resolution.covers(location, target);
    }
}
