package com.airsentinel.harmonizer.alert;

import com.airsentinel.core.model.Location;
import com.airsentinel.core.model.Pollutant;

import java.util.Objects;

public record AlertKey(Location location, Pollutant pollutant) {
    public AlertKey {
        Objects.requireNonNull(location, "location is required");
        Objects.requireNonNull(pollutant, "pollutant is required");
    }
}
