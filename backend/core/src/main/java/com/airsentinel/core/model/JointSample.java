package com.airsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

public record JointSample(
        Instant bucketStart,
        Double value,
        double groundWeight,
        double satelliteWeight,
        SampleStatus status
) {
    public JointSample {
        Objects.requireNonNull(bucketStart, "bucketStart is required");
        Objects.requireNonNull(status, "status is required");
        if ((value == null) != (status == SampleStatus.MISSING)) {
            throw new IllegalArgumentException("Only missing samples may lack a value");
        }
        if (value != null && (!Double.isFinite(value) || value < 0.0)) {
            throw new IllegalArgumentException("Sample value must be finite and >= 0: " + value);
        }
    }

    public static JointSample observed(Instant bucketStart, double value, double groundWeight, double satelliteWeight) {
        return new JointSample(bucketStart, value, groundWeight, satelliteWeight, SampleStatus.OBSERVED);
    }

    public static JointSample imputed(Instant bucketStart, double value) {
        return new JointSample(bucketStart, value, 0.0, 0.0, SampleStatus.IMPUTED);
    }

    public static JointSample missing(Instant bucketStart) {
        return new JointSample(bucketStart, null, 0.0, 0.0, SampleStatus.MISSING);
    }

    public boolean isMissing() {
        return status == SampleStatus.MISSING;
    }

    public boolean isImputed() {
        return status == SampleStatus.IMPUTED;
    }
}
