package com.airsentinel.harmonizer.forecast;

import java.util.Arrays;

final class OutlierFilter {
    static final int MIN_POINTS = 4;
    private static final double FENCE = 1.5;

    private final double lower;
    private final double upper;

    private OutlierFilter(double lower, double upper) {
        this.lower = lower;
        this.upper = upper;
    }

    static OutlierFilter fit(double[] values) {
        if (values.length < MIN_POINTS) {
            return new OutlierFilter(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double q1 = quantile(sorted, 0.25);
        double q3 = quantile(sorted, 0.75);
        double iqr = q3 - q1;
        return new OutlierFilter(Math.max(0.0, q1 - FENCE * iqr), q3 + FENCE * iqr);
    }

    boolean isOutlier(double value) {
        return value < lower || value > upper;
    }

    static double quantile(double[] sorted, double q) {
        double position = (sorted.length - 1) * q;
        int below = (int) Math.floor(position);
        int above = (int) Math.ceil(position);
        return sorted[below] + (sorted[above] - sorted[below]) * (position - below);
    }
}
