package com.airsentinel.service.cache;

import com.airsentinel.core.model.Location;
import com.airsentinel.core.model.Pollutant;
import com.airsentinel.core.model.TimeWindow;

import java.util.Objects;

public record CacheKey(Location location, Pollutant pollutant, TimeWindow window) {
    public CacheKey {
        Objects.requireNonNull(location, "location is required");
        Objects.requireNonNull(pollutant, "pollutant is required");
        Objects.requireNonNull(window, "window is required");
    }
}
