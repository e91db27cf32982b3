package com.airsentinel.harmonizer.api;

import com.airsentinel.core.model.Measurement;
import com.airsentinel.core.model.Pollutant;
import com.airsentinel.core.model.TimeWindow;

import java.util.Collection;
import java.util.List;

public interface MeasurementStore {
    void addAll(Collection<Measurement> measurements);

    List<Measurement> find(Pollutant pollutant, TimeWindow window);

    int size();
}
