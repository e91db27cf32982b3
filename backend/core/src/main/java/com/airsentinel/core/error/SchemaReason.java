package com.airsentinel.core.error;

import java.util.Locale;

public enum SchemaReason {
    MISSING_FIELD,
    OUT_OF_COVERAGE,
    UNKNOWN_UNIT,
    UNKNOWN_POLLUTANT,
    INCOMPATIBLE_UNIT,
    INVALID_VALUE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
