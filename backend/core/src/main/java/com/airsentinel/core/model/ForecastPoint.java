package com.airsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

public record ForecastPoint(Instant timestamp, double estimate, double lower, double upper) {
    public ForecastPoint {
        Objects.requireNonNull(timestamp, "timestamp is required");
        if (!(lower >= 0.0 && lower <= estimate && estimate <= upper)) {
            throw new IllegalArgumentException(
                    "Forecast bounds must satisfy 0 <= lower <= estimate <= upper: " + lower + ", " + estimate + ", " + upper);
        }
    }

    public double bandWidth() {
        return upper - lower;
    }
}
