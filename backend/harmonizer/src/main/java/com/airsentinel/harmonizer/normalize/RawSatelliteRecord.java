package com.airsentinel.harmonizer.normalize;

import com.airsentinel.core.model.SourceKind;

import java.time.Instant;

public record RawSatelliteRecord(
        String product,
        String pollutant,
        Double columnValue,
        String unit,
        Double cellCenterLat,
        Double cellCenterLon,
        Double cellLatExtent,
        Double cellLonExtent,
        Instant timestamp
) implements RawRecord {
    @Override
    public SourceKind sourceKind() {
        return SourceKind.SATELLITE;
    }
}
