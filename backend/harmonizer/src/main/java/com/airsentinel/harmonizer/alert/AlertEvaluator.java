package com.airsentinel.harmonizer.alert;

import com.airsentinel.core.model.AlertEvent;
import com.airsentinel.core.model.AlertReason;
import com.airsentinel.core.model.Category;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rising-edge alerting per location and pollutant.
 * <p>
 * An observed category above the previous one emits an {@code observed} event; staying put or
 * falling emits nothing and moves the state down so the next rise is reported again. Independently,
 * the worst forecast category above the current state emits one {@code forecasted} event, stamped
 * with the first step that reaches it; it is not repeated while the same or a milder rise keeps
 * being forecast.
 */
public final class AlertEvaluator {

    public AlertEvaluation evaluate(
            AlertKey key,
            Category current,
            Instant observedAt,
            List<ForecastedCategory> forecast,
            AlertState previous
    ) {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(forecast, "forecast is required");
        Objects.requireNonNull(previous, "previous state is required");

        List<AlertEvent> events = new ArrayList<>();
        Category state = previous.category();
        if (current != null) {
            Objects.requireNonNull(observedAt, "observedAt is required with a current category");
            if (current.isWorseThan(state)) {
                events.add(new AlertEvent(key.location(), key.pollutant(), current, observedAt, AlertReason.OBSERVED));
            }
            state = current;
        }

        Category announced = previous.announcedForecast();
        ForecastedCategory rise = worstRiseAbove(state, forecast);
        if (rise == null) {
            announced = null;
        } else if (announced == null || rise.category().isWorseThan(announced)) {
            events.add(new AlertEvent(key.location(), key.pollutant(), rise.category(), rise.timestamp(), AlertReason.FORECASTED));
            announced = rise.category();
        }
        return new AlertEvaluation(events, new AlertState(state, announced));
    }

    private static ForecastedCategory worstRiseAbove(Category state, List<ForecastedCategory> forecast) {
        ForecastedCategory worst = null;
        for (ForecastedCategory step : forecast) {
            if (!step.category().isWorseThan(state)) {
                continue;
            }
            if (worst == null || step.category().isWorseThan(worst.category())) {
                worst = step;
            }
        }
        return worst;
    }
}
