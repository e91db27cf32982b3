package com.airsentinel.harmonizer.normalize;

import com.airsentinel.core.error.SchemaException;
import com.airsentinel.core.error.SchemaReason;
import com.airsentinel.core.model.Pollutant;
import com.airsentinel.core.model.Unit;

import java.util.OptionalDouble;

final class UnitConversions {
    // Ideal gas at 25 °C and 1 atm, in litres.
    static final double MOLAR_VOLUME_L = 24.45;
    static final double AVOGADRO = 6.02214076e23;

    private UnitConversions() {
    }

    static double groundToMicrograms(Pollutant pollutant, double value, Unit unit) {
        switch (unit) {
            case MICROGRAMS_PER_CUBIC_METER:
                return value;
            case MILLIGRAMS_PER_CUBIC_METER:
                return value * 1000.0;
            case PARTS_PER_BILLION:
                return value * molarMass(pollutant, unit) / MOLAR_VOLUME_L;
            case PARTS_PER_MILLION:
                return value * 1000.0 * molarMass(pollutant, unit) / MOLAR_VOLUME_L;
            default:
                throw incompatible(pollutant, unit, "ground sensors");
        }
    }

    static Unit columnUnit(Unit unit) {
        return unit == Unit.MOLECULES_PER_SQUARE_CENTIMETER ? Unit.MOLES_PER_SQUARE_METER : unit;
    }

    static double toColumnUnit(double value, Unit unit) {
        if (unit == Unit.MOLECULES_PER_SQUARE_CENTIMETER) {
            return value * 1e4 / AVOGADRO;
        }
        return value;
    }

    private static double molarMass(Pollutant pollutant, Unit unit) {
        OptionalDouble mass = pollutant.molarMass();
        if (mass.isEmpty()) {
            throw incompatible(pollutant, unit, "particulate matter");
        }
        return mass.getAsDouble();
    }

    static SchemaException incompatible(Pollutant pollutant, Unit unit, String context) {
        return new SchemaException(
                SchemaReason.INCOMPATIBLE_UNIT,
                unit.symbol() + " is not convertible for " + pollutant.code() + " (" + context + ")"
        );
    }
}
