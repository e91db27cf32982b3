package com.airsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertReason {
    OBSERVED("observed"),
    FORECASTED("forecasted");

    private final String wireName;

    AlertReason(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
