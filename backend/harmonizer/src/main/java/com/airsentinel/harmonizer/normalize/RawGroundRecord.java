package com.airsentinel.harmonizer.normalize;

import com.airsentinel.core.model.SourceKind;

import java.time.Instant;

public record RawGroundRecord(
        String pollutant,
        Double value,
        String unit,
        Double latitude,
        Double longitude,
        Instant timestamp
) implements RawRecord {
    @Override
    public SourceKind sourceKind() {
        return SourceKind.GROUND;
    }
}
