package com.airsentinel.core.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

// Ascending by timestamp, no duplicate timestamps.
public record TimeSeries(Pollutant pollutant, SourceKind source, List<Measurement> measurements) {
    public TimeSeries {
        Objects.requireNonNull(pollutant, "pollutant is required");
        Objects.requireNonNull(source, "source is required");
        measurements = List.copyOf(measurements);
        for (int i = 0; i < measurements.size(); i++) {
            Measurement m = measurements.get(i);
            if (m.pollutant() != pollutant || m.source() != source) {
                throw new IllegalArgumentException("Series " + pollutant + "/" + source + " cannot hold " + m.pollutant() + "/" + m.source());
            }
            if (i > 0 && !m.timestamp().isAfter(measurements.get(i - 1).timestamp())) {
                throw new IllegalArgumentException("Series must be strictly ascending; offending timestamp " + m.timestamp());
            }
        }
    }

    public static TimeSeries empty(Pollutant pollutant, SourceKind source) {
        return new TimeSeries(pollutant, source, List.of());
    }

    public static TimeSeries sorted(Pollutant pollutant, SourceKind source, List<Measurement> measurements) {
        List<Measurement> copy = new ArrayList<>(measurements);
        copy.sort(Comparator.comparing(Measurement::timestamp));
        return new TimeSeries(pollutant, source, copy);
    }

    public boolean isEmpty() {
        return measurements.isEmpty();
    }

    public int size() {
        return measurements.size();
    }
}
