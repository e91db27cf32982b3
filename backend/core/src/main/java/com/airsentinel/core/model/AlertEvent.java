package com.airsentinel.core.model;

import java.time.Instant;
import java.util.Objects;

public record AlertEvent(
        Location location,
        Pollutant pollutant,
        Category category,
        Instant triggeredAt,
        AlertReason reason
) {
    public AlertEvent {
        Objects.requireNonNull(location, "location is required");
        Objects.requireNonNull(pollutant, "pollutant is required");
        Objects.requireNonNull(category, "category is required");
        Objects.requireNonNull(triggeredAt, "triggeredAt is required");
        Objects.requireNonNull(reason, "reason is required");
    }
}
