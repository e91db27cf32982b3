package com.airsentinel.harmonizer.align;

import java.time.Duration;
import java.util.Objects;

public record AlignerSettings(Duration bucketWidth, Duration groundTolerance, Duration satelliteTolerance) {
    public AlignerSettings {
        requirePositive(bucketWidth, "bucketWidth");
        requirePositive(groundTolerance, "groundTolerance");
        requirePositive(satelliteTolerance, "satelliteTolerance");
    }

    public static AlignerSettings defaults() {
        return new AlignerSettings(Duration.ofHours(1), Duration.ofHours(2), Duration.ofHours(1));
    }

    private static void requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name + " is required");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }
}
