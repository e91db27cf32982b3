package com.airsentinel.service.store;

import com.airsentinel.core.model.Measurement;
import com.airsentinel.core.model.Pollutant;
import com.airsentinel.core.model.TimeWindow;
import com.airsentinel.harmonizer.api.MeasurementStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

public final class InMemoryMeasurementStore implements MeasurementStore {
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Pollutant, List<Measurement>> byPollutant = new EnumMap<>(Pollutant.class);
    private int size;

    @Override
    public void addAll(Collection<Measurement> measurements) {
        lock.lock();
        try {
            for (Measurement measurement : measurements) {
                byPollutant.computeIfAbsent(measurement.pollutant(), ignored -> new ArrayList<>()).add(measurement);
                size++;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Measurement> find(Pollutant pollutant, TimeWindow window) {
        lock.lock();
        try {
            List<Measurement> matches = new ArrayList<>();
            for (Measurement measurement : byPollutant.getOrDefault(pollutant, List.of())) {
                if (window.contains(measurement.timestamp())) {
                    matches.add(measurement);
                }
            }
            return matches;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return size;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            byPollutant.clear();
            size = 0;
        } finally {
            lock.unlock();
        }
    }
}
