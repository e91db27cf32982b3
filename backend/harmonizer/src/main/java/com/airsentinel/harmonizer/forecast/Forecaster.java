package com.airsentinel.harmonizer.forecast;

import com.airsentinel.core.model.ForecastResult;
import com.airsentinel.core.model.JointSeries;

public interface Forecaster {
    String modelType();

    // Fails with ForecastException instead of extrapolating from too little history.
    ForecastResult forecast(JointSeries series, int horizonSteps);
}
