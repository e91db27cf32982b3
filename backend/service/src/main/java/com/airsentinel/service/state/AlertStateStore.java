package com.airsentinel.service.state;

import com.airsentinel.harmonizer.alert.AlertEvaluation;
import com.airsentinel.harmonizer.alert.AlertKey;
import com.airsentinel.harmonizer.alert.AlertState;

import java.util.function.Function;

public interface AlertStateStore {
    AlertState get(AlertKey key);

    // Atomic per key.
    AlertEvaluation update(AlertKey key, Function<AlertState, AlertEvaluation> step);
}
