package com.airsentinel.core.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record JointSeries(
        Location location,
        Pollutant pollutant,
        TimeWindow window,
        Duration bucketWidth,
        List<JointSample> samples
) {
    public JointSeries {
        Objects.requireNonNull(location, "location is required");
        Objects.requireNonNull(pollutant, "pollutant is required");
        Objects.requireNonNull(window, "window is required");
        Objects.requireNonNull(bucketWidth, "bucketWidth is required");
        samples = List.copyOf(samples);
    }

    public Optional<JointSample> latestPresent() {
        for (int i = samples.size() - 1; i >= 0; i--) {
            if (!samples.get(i).isMissing()) {
                return Optional.of(samples.get(i));
            }
        }
        return Optional.empty();
    }

    public long presentCount() {
        return samples.stream().filter(sample -> !sample.isMissing()).count();
    }

    public long count(SampleStatus status) {
        return samples.stream().filter(sample -> sample.status() == status).count();
    }
}
