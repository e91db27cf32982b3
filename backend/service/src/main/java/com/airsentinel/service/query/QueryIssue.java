package com.airsentinel.service.query;

import com.airsentinel.core.error.AirQualityException;
import com.airsentinel.core.model.Pollutant;

public record QueryIssue(Pollutant pollutant, String code, String message) {
    public static QueryIssue of(Pollutant pollutant, AirQualityException error) {
        return new QueryIssue(pollutant, error.code(), error.getMessage());
    }
}
