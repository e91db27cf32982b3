package com.airsentinel.harmonizer.classify;

import com.airsentinel.core.error.ClassificationException;
import com.airsentinel.core.model.Category;
import com.airsentinel.core.model.Pollutant;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AqiClassifierTest {
    private final AqiClassifier classifier = AqiClassifier.withDefaults();

    @Test
    void pm25BandsUseDefaultBreakpoints() {
        assertEquals(Category.GOOD, classifier.classify(Pollutant.PM25, 0.0));
        assertEquals(Category.GOOD, classifier.classify(Pollutant.PM25, 12.0));
        assertEquals(Category.MODERATE, classifier.classify(Pollutant.PM25, 12.1));
        assertEquals(Category.MODERATE, classifier.classify(Pollutant.PM25, 35.0));
        assertEquals(Category.UNHEALTHY, classifier.classify(Pollutant.PM25, 55.5));
        assertEquals(Category.UNHEALTHY, classifier.classify(Pollutant.PM25, 400.0));
    }

    @Test
    void valueOnBreakpointBelongsToHigherCategory() {
        AqiClassifier custom = new AqiClassifier(Map.of(Pollutant.O3, new BreakpointTable(50.0, 100.0)));

        assertEquals(Category.GOOD, custom.classify(Pollutant.O3, Math.nextDown(50.0)));
        assertEquals(Category.MODERATE, custom.classify(Pollutant.O3, 50.0));
        assertEquals(Category.MODERATE, custom.classify(Pollutant.O3, Math.nextDown(100.0)));
        assertEquals(Category.UNHEALTHY, custom.classify(Pollutant.O3, 100.0));
    }

    @Test
    void classificationIsMonotonicInConcentration() {
        for (Pollutant pollutant : Pollutant.values()) {
            Category previous = Category.GOOD;
            for (double value = 0.0; value <= 800.0; value += 0.5) {
                Category category = classifier.classify(pollutant, value);
                assertFalse(previous.isWorseThan(category), pollutant + " dropped at " + value);
                previous = category;
            }
        }
    }

    @Test
    void overallIsWorstAcrossPollutants() {
        Map<Pollutant, Double> concentrations = new EnumMap<>(Pollutant.class);
        concentrations.put(Pollutant.PM25, 20.0);
        concentrations.put(Pollutant.NO2, 700.0);
        concentrations.put(Pollutant.O3, 10.0);

        assertEquals(Category.MODERATE, classifier.classify(Pollutant.PM25, 20.0));
        assertEquals(Category.UNHEALTHY, classifier.overall(concentrations).orElseThrow());
        assertTrue(classifier.overall(Map.of()).isEmpty());
    }

    @Test
    void pollutantWithoutTableIsRejected() {
        AqiClassifier pmOnly = new AqiClassifier(Map.of(Pollutant.PM25, new BreakpointTable(12.1, 55.5)));

        ClassificationException error = assertThrows(ClassificationException.class, () -> pmOnly.classify(Pollutant.NO2, 10.0));
        assertEquals("classification_error:unsupported_pollutant", error.code());
        assertEquals(Pollutant.NO2, error.pollutant());
        assertFalse(pmOnly.supports(Pollutant.NO2));
        assertTrue(pmOnly.supports(Pollutant.PM25));
    }

    @Test
    void negativeOrNonFiniteValuesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> classifier.classify(Pollutant.PM25, -0.1));
        assertThrows(IllegalArgumentException.class, () -> classifier.classify(Pollutant.PM25, Double.NaN));
    }

    @Test
    void breakpointsMustIncrease() {
        assertThrows(IllegalArgumentException.class, () -> new BreakpointTable(50.0, 50.0));
        assertThrows(IllegalArgumentException.class, () -> new BreakpointTable(0.0, 10.0));
    }
}
