package com.airsentinel.harmonizer.alert;

import com.airsentinel.core.model.Category;

import java.util.Objects;

// announcedForecast is null when no forecasted rise is outstanding.
public record AlertState(Category category, Category announcedForecast) {
    private static final AlertState INITIAL = new AlertState(Category.GOOD, null);

    public AlertState {
        Objects.requireNonNull(category, "category is required");
    }

    public static AlertState initial() {
        return INITIAL;
    }
}
