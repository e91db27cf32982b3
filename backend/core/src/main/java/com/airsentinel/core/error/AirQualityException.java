package com.airsentinel.core.error;

public abstract class AirQualityException extends RuntimeException {
    protected AirQualityException(String message) {
        super(message);
    }

    protected AirQualityException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String kind();

    public abstract String reason();

    public String code() {
        return kind() + ":" + reason();
    }
}
