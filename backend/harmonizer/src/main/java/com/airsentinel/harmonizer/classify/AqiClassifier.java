package com.airsentinel.harmonizer.classify;

import com.airsentinel.core.error.ClassificationException;
import com.airsentinel.core.model.Category;
import com.airsentinel.core.model.Pollutant;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

// Defaults are the US EPA breakpoints collapsed to three bands, in µg/m³ at 25 °C.
public final class AqiClassifier {
    private final Map<Pollutant, BreakpointTable> tables;

    public AqiClassifier(Map<Pollutant, BreakpointTable> tables) {
        Map<Pollutant, BreakpointTable> copy = new EnumMap<>(Pollutant.class);
        copy.putAll(tables);
        this.tables = Map.copyOf(copy);
    }

    public static AqiClassifier withDefaults() {
        return new AqiClassifier(defaultTables());
    }

    public static Map<Pollutant, BreakpointTable> defaultTables() {
        Map<Pollutant, BreakpointTable> tables = new EnumMap<>(Pollutant.class);
        tables.put(Pollutant.PM25, new BreakpointTable(12.1, 55.5));
        // 54 / 361 ppb
        tables.put(Pollutant.NO2, new BreakpointTable(101.6, 678.7));
        // 55 / 86 ppb, 8-hour scale
        tables.put(Pollutant.O3, new BreakpointTable(107.8, 168.6));
        return tables;
    }

    public boolean supports(Pollutant pollutant) {
        return tables.containsKey(pollutant);
    }

    public Category classify(Pollutant pollutant, double value) {
        BreakpointTable table = tables.get(pollutant);
        if (table == null) {
            throw new ClassificationException(pollutant);
        }
        if (!Double.isFinite(value) || value < 0.0) {
            throw new IllegalArgumentException("Concentration must be finite and >= 0: " + value);
        }
        return table.categorize(value);
    }

    public Optional<Category> overall(Map<Pollutant, Double> concentrations) {
        List<Category> categories = new ArrayList<>();
        concentrations.forEach((pollutant, value) -> categories.add(classify(pollutant, value)));
        return Category.worst(categories);
    }
}
