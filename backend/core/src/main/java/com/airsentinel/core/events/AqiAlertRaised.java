package com.airsentinel.core.events;

import com.airsentinel.core.model.AlertEvent;

import java.time.Instant;

public record AqiAlertRaised(Instant timestamp, AlertEvent alert) implements Event {
    @Override
    public String type() {
        return "AqiAlertRaised";
    }
}
