package com.airsentinel.core.model;

public enum SourceKind {
    GROUND,
    SATELLITE
}
