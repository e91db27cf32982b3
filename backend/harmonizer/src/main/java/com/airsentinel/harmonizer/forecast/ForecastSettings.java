package com.airsentinel.harmonizer.forecast;

import java.util.Map;

public record ForecastSettings(
        int minHistory,
        double confidenceLevel,
        double imputedWeight,
        double levelSmoothing,
        double trendSmoothing
) {
    private static final Map<Double, Double> Z_SCORES = Map.of(
            0.80, 1.2816,
            0.90, 1.6449,
            0.95, 1.9600,
            0.99, 2.5758
    );

    public ForecastSettings {
        if (minHistory < 2) {
            throw new IllegalArgumentException("minHistory must be at least 2: " + minHistory);
        }
        if (!Z_SCORES.containsKey(confidenceLevel)) {
            throw new IllegalArgumentException("Unsupported confidence level " + confidenceLevel + "; use one of " + Z_SCORES.keySet());
        }
        requireGain(imputedWeight, "imputedWeight");
        requireGain(levelSmoothing, "levelSmoothing");
        requireGain(trendSmoothing, "trendSmoothing");
    }

    public static ForecastSettings defaults() {
        return new ForecastSettings(10, 0.80, 0.5, 0.5, 0.1);
    }

    public double zScore() {
        return Z_SCORES.get(confidenceLevel);
    }

    private static void requireGain(double value, String name) {
        if (!(value > 0.0 && value <= 1.0)) {
            throw new IllegalArgumentException(name + " must be in (0, 1]: " + value);
        }
    }
}
