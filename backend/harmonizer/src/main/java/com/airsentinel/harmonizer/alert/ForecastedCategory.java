package com.airsentinel.harmonizer.alert;

import com.airsentinel.core.model.Category;

import java.time.Instant;
import java.util.Objects;

public record ForecastedCategory(Instant timestamp, Category category) {
    public ForecastedCategory {
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(category, "category is required");
    }
}
