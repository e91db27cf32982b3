package com.airsentinel.harmonizer.normalize;

import com.airsentinel.core.model.Pollutant;
import com.airsentinel.core.model.Unit;

import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;

public record SatelliteConversions(Map<Pollutant, Double> columnFactors, Map<Pollutant, Double> aodFactors) {
    // 1 mol/m² spread over a 1 km mixing height, times molar mass, gives µg/m³.
    private static final double MIXING_HEIGHT_M = 1000.0;
    private static final double PM25_PER_UNIT_AOD = 100.0;

    public SatelliteConversions {
        columnFactors = copyPositive(columnFactors);
        aodFactors = copyPositive(aodFactors);
    }

    public static SatelliteConversions defaults() {
        Map<Pollutant, Double> column = new EnumMap<>(Pollutant.class);
        for (Pollutant pollutant : Pollutant.values()) {
            pollutant.molarMass().ifPresent(mass -> column.put(pollutant, mass * 1e6 / MIXING_HEIGHT_M));
        }
        return new SatelliteConversions(column, Map.of(Pollutant.PM25, PM25_PER_UNIT_AOD));
    }

    public OptionalDouble factor(Pollutant pollutant, Unit unit) {
        Double factor = switch (unit) {
            case MOLES_PER_SQUARE_METER -> columnFactors.get(pollutant);
            case AEROSOL_OPTICAL_DEPTH -> aodFactors.get(pollutant);
            default -> null;
        };
        return factor == null ? OptionalDouble.empty() : OptionalDouble.of(factor);
    }

    private static Map<Pollutant, Double> copyPositive(Map<Pollutant, Double> factors) {
        Map<Pollutant, Double> copy = new EnumMap<>(Pollutant.class);
        if (factors == null) {
            return copy;
        }
        factors.forEach((pollutant, factor) -> {
            if (factor == null || !(factor > 0.0) || factor.isInfinite()) {
                throw new IllegalArgumentException("Conversion factor for " + pollutant + " must be positive: " + factor);
            }
            copy.put(pollutant, factor);
        });
        return Map.copyOf(copy);
    }
}
