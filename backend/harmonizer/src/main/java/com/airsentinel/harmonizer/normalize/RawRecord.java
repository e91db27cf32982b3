package com.airsentinel.harmonizer.normalize;

import com.airsentinel.core.model.SourceKind;

public sealed interface RawRecord permits RawGroundRecord, RawSatelliteRecord {
    SourceKind sourceKind();
}
