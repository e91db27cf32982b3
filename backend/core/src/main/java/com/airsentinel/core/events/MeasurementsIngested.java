package com.airsentinel.core.events;

import java.time.Instant;
import java.util.Map;

public record MeasurementsIngested(
        Instant timestamp,
        int accepted,
        int rejected,
        Map<String, Integer> rejectionsByReason
) implements Event {
    @Override
    public String type() {
        return "MeasurementsIngested";
    }
}
