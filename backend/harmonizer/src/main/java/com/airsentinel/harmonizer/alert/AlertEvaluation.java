package com.airsentinel.harmonizer.alert;

import com.airsentinel.core.model.AlertEvent;

import java.util.List;

public record AlertEvaluation(List<AlertEvent> events, AlertState nextState) {
    public AlertEvaluation {
        events = List.copyOf(events);
    }
}
