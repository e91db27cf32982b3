package com.airsentinel.service.state;

import com.airsentinel.harmonizer.alert.AlertEvaluation;
import com.airsentinel.harmonizer.alert.AlertKey;
import com.airsentinel.harmonizer.alert.AlertState;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

public final class InMemoryAlertStateStore implements AlertStateStore {
    private final Map<AlertKey, AlertState> states = new ConcurrentHashMap<>();

    @Override
    public AlertState get(AlertKey key) {
        return states.getOrDefault(key, AlertState.initial());
    }

    @Override
    public AlertEvaluation update(AlertKey key, Function<AlertState, AlertEvaluation> step) {
        AtomicReference<AlertEvaluation> result = new AtomicReference<>();
        states.compute(key, (ignored, previous) -> {
            AlertEvaluation evaluation = step.apply(previous == null ? AlertState.initial() : previous);
            result.set(evaluation);
            return evaluation.nextState();
        });
        return result.get();
    }
}
