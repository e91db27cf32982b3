package com.airsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

public enum Pollutant {
    PM25("pm25", Double.NaN),
    NO2("no2", 46.0055),
    O3("o3", 47.9982);

    private final String code;
    private final double molarMass;

    Pollutant(String code, double molarMass) {
        this.code = code;
        this.molarMass = molarMass;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public OptionalDouble molarMass() {
        return Double.isNaN(molarMass) ? OptionalDouble.empty() : OptionalDouble.of(molarMass);
    }

    public static Optional<Pollutant> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "pm25":
            case "pm2.5":
            case "pm2_5":
                return Optional.of(PM25);
            case "no2":
                return Optional.of(NO2);
            case "o3":
                return Optional.of(O3);
            default:
                return Optional.empty();
        }
    }

    @JsonCreator
    static Pollutant parse(String code) {
        return fromCode(code).orElseThrow(() -> new IllegalArgumentException("Unknown pollutant code: " + code));
    }
}
