package com.airsentinel.harmonizer.classify;

import com.airsentinel.core.model.Category;

// Concentrations in µg/m³; a value equal to a breakpoint belongs to the higher category.
public record BreakpointTable(double moderateFrom, double unhealthyFrom) {
    public BreakpointTable {
        if (!Double.isFinite(moderateFrom) || !Double.isFinite(unhealthyFrom)) {
            throw new IllegalArgumentException("Breakpoints must be finite");
        }
        if (!(moderateFrom > 0.0 && moderateFrom < unhealthyFrom)) {
            throw new IllegalArgumentException(
                    "Breakpoints must be positive and strictly increasing: " + moderateFrom + ", " + unhealthyFrom);
        }
    }

    public Category categorize(double value) {
        if (value >= unhealthyFrom) {
            return Category.UNHEALTHY;
        }
        if (value >= moderateFrom) {
            return Category.MODERATE;
        }
        return Category.GOOD;
    }
}
