package com.airsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum Unit {
    MICROGRAMS_PER_CUBIC_METER("µg/m³", true, List.of("µg/m³", "µg/m3", "ug/m3", "ug/m³", "ugm3")),
    MOLES_PER_SQUARE_METER("mol/m²", true, List.of("mol/m²", "mol/m2", "mol/m^2", "mol m-2")),
    MILLIGRAMS_PER_CUBIC_METER("mg/m³", false, List.of("mg/m³", "mg/m3")),
    PARTS_PER_BILLION("ppb", false, List.of("ppb")),
    PARTS_PER_MILLION("ppm", false, List.of("ppm")),
    MOLECULES_PER_SQUARE_CENTIMETER("molecules/cm²", false, List.of("molecules/cm²", "molecules/cm2", "molec/cm2", "molec/cm^2")),
    AEROSOL_OPTICAL_DEPTH("aod", false, List.of("aod", "1"));

    private final String symbol;
    private final boolean canonical;
    private final List<String> aliases;

    Unit(String symbol, boolean canonical, List<String> aliases) {
        this.symbol = symbol;
        this.canonical = canonical;
        this.aliases = aliases;
    }

    @JsonValue
    public String symbol() {
        return symbol;
    }

    public boolean canonical() {
        return canonical;
    }

    public static Optional<Unit> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Unit unit : values()) {
            for (String alias : unit.aliases) {
                if (alias.toLowerCase(Locale.ROOT).equals(normalized)) {
                    return Optional.of(unit);
                }
            }
        }
        return Optional.empty();
    }
}
