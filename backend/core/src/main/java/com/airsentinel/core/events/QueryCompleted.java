package com.airsentinel.core.events;

import com.airsentinel.core.model.Category;
import com.airsentinel.core.model.Location;

import java.time.Instant;
import java.util.List;

public record QueryCompleted(
        Instant timestamp,
        Location location,
        Category overallCategory,
        int alertCount,
        List<String> issueCodes,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "QueryCompleted";
    }
}
