package com.airsentinel.service.query;

import com.airsentinel.core.model.Location;
import com.airsentinel.core.model.Pollutant;
import com.airsentinel.core.model.TimeWindow;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

public record QueryRequest(Location location, Set<Pollutant> pollutants, TimeWindow window, int horizonSteps) {
    public QueryRequest {
        Objects.requireNonNull(location, "location is required");
        Objects.requireNonNull(window, "window is required");
        if (pollutants == null || pollutants.isEmpty()) {
            throw new IllegalArgumentException("At least one pollutant is required");
        }
        if (horizonSteps < 1) {
            throw new IllegalArgumentException("horizonSteps must be >= 1: " + horizonSteps);
        }
        pollutants = Collections.unmodifiableSet(EnumSet.copyOf(pollutants));
    }
}
