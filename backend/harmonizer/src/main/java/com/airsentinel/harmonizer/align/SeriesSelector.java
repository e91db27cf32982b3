package com.airsentinel.harmonizer.align;

import com.airsentinel.core.model.Location;
import com.airsentinel.core.model.Measurement;
import com.airsentinel.core.model.Pollutant;
import com.airsentinel.core.model.SourceKind;
import com.airsentinel.core.model.TimeSeries;
import com.airsentinel.core.model.TimeWindow;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public final class SeriesSelector {
    private final double searchRadiusKm;

    public SeriesSelector(double searchRadiusKm) {
        if (!(searchRadiusKm > 0.0)) {
            throw new IllegalArgumentException("searchRadiusKm must be positive: " + searchRadiusKm);
        }
        this.searchRadiusKm = searchRadiusKm;
    }

    public TimeSeries groundSeries(Location target, Pollutant pollutant, TimeWindow window, Collection<Measurement> pool) {
        Map<Location, Map<Instant, Measurement>> stations = new LinkedHashMap<>();
        for (Measurement m : pool) {
            if (m.source() != SourceKind.GROUND || m.pollutant() != pollutant || !window.contains(m.timestamp())) {
                continue;
            }
            if (m.location().distanceKm(target) > searchRadiusKm) {
                continue;
            }
            stations.computeIfAbsent(m.location(), ignored -> new LinkedHashMap<>()).put(m.timestamp(), m);
        }
        Comparator<Location> nearest = Comparator.<Location>comparingDouble(station -> station.distanceKm(target))
                .thenComparingDouble(Location::lat)
                .thenComparingDouble(Location::lon);
        return stations.keySet().stream()
                .min(nearest)
                .map(station -> TimeSeries.sorted(pollutant, SourceKind.GROUND, new ArrayList<>(stations.get(station).values())))
                .orElseGet(() -> TimeSeries.empty(pollutant, SourceKind.GROUND));
    }

    public TimeSeries satelliteSeries(Location target, Pollutant pollutant, TimeWindow window, Collection<Measurement> pool) {
        Comparator<Measurement> preference = Comparator.<Measurement>comparingDouble(m -> m.resolution().areaDeg2())
                .thenComparingDouble(m -> m.location().distanceKm(target));
        Map<Instant, Measurement> byTimestamp = new TreeMap<>();
        for (Measurement m : pool) {
            if (m.source() != SourceKind.SATELLITE || m.pollutant() != pollutant || !window.contains(m.timestamp())) {
                continue;
            }
            if (!m.covers(target)) {
                continue;
            }
            byTimestamp.merge(m.timestamp(), m, (current, candidate) -> preference.compare(candidate, current) <= 0 ? candidate : current);
        }
        List<Measurement> selected = new ArrayList<>(byTimestamp.values());
        return new TimeSeries(pollutant, SourceKind.SATELLITE, selected);
    }
}
