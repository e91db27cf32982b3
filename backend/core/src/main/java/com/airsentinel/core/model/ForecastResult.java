package com.airsentinel.core.model;

import java.util.List;
import java.util.Objects;

public record ForecastResult(
        Pollutant pollutant,
        String modelType,
        double confidenceLevel,
        int trainingPoints,
        int imputedPoints,
        int discardedOutliers,
        List<ForecastPoint> points
) {
    public ForecastResult {
        Objects.requireNonNull(pollutant, "pollutant is required");
        points = List.copyOf(points);
        for (int i = 1; i < points.size(); i++) {
            if (!points.get(i).timestamp().isAfter(points.get(i - 1).timestamp())) {
                throw new IllegalArgumentException("Forecast horizon must be strictly increasing");
            }
        }
    }
}
