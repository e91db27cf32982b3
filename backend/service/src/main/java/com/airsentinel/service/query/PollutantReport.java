package com.airsentinel.service.query;

import com.airsentinel.core.model.Category;
import com.airsentinel.core.model.ForecastResult;
import com.airsentinel.core.model.JointSeries;
import com.airsentinel.core.model.Pollutant;

import java.time.Instant;

// current* fields are null when nothing was classified; forecast is null when forecasting failed.
public record PollutantReport(
        Pollutant pollutant,
        JointSeries jointSeries,
        Category currentCategory,
        Double currentValue,
        Instant currentAt,
        ForecastResult forecast
) {
}
