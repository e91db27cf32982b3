package com.airsentinel.core.error;

import com.airsentinel.core.model.Pollutant;

public class ClassificationException extends AirQualityException {
    private final Pollutant pollutant;

    public ClassificationException(Pollutant pollutant) {
        super("unsupported_pollutant: no breakpoint table for " + pollutant.code());
        this.pollutant = pollutant;
    }

    public Pollutant pollutant() {
        return pollutant;
    }

    @Override
    public String kind() {
        return "classification_error";
    }

    @Override
    public String reason() {
        return "unsupported_pollutant";
    }
}
