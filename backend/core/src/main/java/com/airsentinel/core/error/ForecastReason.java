package com.airsentinel.core.error;

import java.util.Locale;

public enum ForecastReason {
    INSUFFICIENT_HISTORY,
    INVALID_HISTORY;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
