package com.airsentinel.core.error;

public class ForecastException extends AirQualityException {
    private final ForecastReason forecastReason;

    public ForecastException(ForecastReason forecastReason, String message) {
        super(forecastReason.wireName() + ": " + message);
        this.forecastReason = forecastReason;
    }

    public ForecastReason forecastReason() {
        return forecastReason;
    }

    @Override
    public String kind() {
        return "forecast_error";
    }

    @Override
    public String reason() {
        return forecastReason.wireName();
    }
}
