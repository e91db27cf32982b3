package com.airsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

public enum Category {
    GOOD,
    MODERATE,
    UNHEALTHY;

    public boolean isWorseThan(Category other) {
        return compareTo(other) > 0;
    }

    public static Category max(Category a, Category b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static Optional<Category> worst(Collection<Category> categories) {
        return categories.stream().reduce(Category::max);
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
