package com.airsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SampleStatus {
    OBSERVED,
    IMPUTED,
    MISSING;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
