package com.airsentinel.harmonizer.normalize;

import com.airsentinel.core.error.SchemaException;
import com.airsentinel.core.error.SchemaReason;
import com.airsentinel.core.model.Location;
import com.airsentinel.core.model.Measurement;
import com.airsentinel.core.model.Pollutant;
import com.airsentinel.core.model.SourceKind;
import com.airsentinel.core.model.SpatialResolution;
import com.airsentinel.core.model.Unit;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

public final class Normalizer {
    private final CoverageBox coverage;
    private final SatelliteConversions conversions;
    private final Map<SourceKind, Function<RawRecord, Measurement>> table = new EnumMap<>(SourceKind.class);

    public Normalizer() {
        this(CoverageBox.defaults(), SatelliteConversions.defaults());
    }

    public Normalizer(CoverageBox coverage, SatelliteConversions conversions) {
        this.coverage = Objects.requireNonNull(coverage, "coverage is required");
        this.conversions = Objects.requireNonNull(conversions, "conversions is required");
        table.put(SourceKind.GROUND, raw -> normalizeGround((RawGroundRecord) raw));
        table.put(SourceKind.SATELLITE, raw -> normalizeSatellite((RawSatelliteRecord) raw));
    }

    public Measurement normalize(RawRecord raw) {
        Objects.requireNonNull(raw, "raw record is required");
        return table.get(raw.sourceKind()).apply(raw);
    }

    public Measurement normalize(RawRecord raw, SourceKind expected) {
        Objects.requireNonNull(raw, "raw record is required");
        if (raw.sourceKind() != expected) {
            throw new IllegalArgumentException("Expected a " + expected + " record but got " + raw.sourceKind());
        }
        return normalize(raw);
    }

    public Measurement validate(Measurement measurement) {
        Objects.requireNonNull(measurement, "measurement is required");
        if (measurement.unit() != Unit.MICROGRAMS_PER_CUBIC_METER) {
            throw new SchemaException(
                    SchemaReason.INCOMPATIBLE_UNIT,
                    "concentrations must be in " + Unit.MICROGRAMS_PER_CUBIC_METER.symbol() + ", got " + measurement.unit().symbol()
            );
        }
        if (measurement.source() == SourceKind.SATELLITE
                && !coverage.contains(measurement.location().lat(), measurement.location().lon())) {
            throw outOfCoverage(measurement.location().lat(), measurement.location().lon());
        }
        return measurement;
    }

    private Measurement normalizeGround(RawGroundRecord raw) {
        Pollutant pollutant = pollutant(raw.pollutant());
        double value = required(raw.value(), "value");
        String unitText = required(raw.unit(), "unit");
        Instant timestamp = required(raw.timestamp(), "timestamp");
        Location location = location(required(raw.latitude(), "latitude"), required(raw.longitude(), "longitude"));

        Unit unit = unit(unitText);
        requireNonNegative(value);
        double canonical = UnitConversions.groundToMicrograms(pollutant, value, unit);
        return new Measurement(
                SourceKind.GROUND,
                pollutant,
                canonical,
                Unit.MICROGRAMS_PER_CUBIC_METER,
                location,
                timestamp,
                SpatialResolution.point()
        );
    }

    private Measurement normalizeSatellite(RawSatelliteRecord raw) {
        Pollutant pollutant = pollutant(raw.pollutant());
        double value = required(raw.columnValue(), "column value");
        String unitText = required(raw.unit(), "unit");
        Instant timestamp = required(raw.timestamp(), "timestamp");
        double lat = required(raw.cellCenterLat(), "cell center latitude");
        double lon = required(raw.cellCenterLon(), "cell center longitude");
        double latExtent = required(raw.cellLatExtent(), "cell latitude extent");
        double lonExtent = required(raw.cellLonExtent(), "cell longitude extent");

        Location center = location(lat, lon);
        if (!(latExtent > 0.0 && lonExtent > 0.0) || Double.isInfinite(latExtent) || Double.isInfinite(lonExtent)) {
            throw new SchemaException(SchemaReason.INVALID_VALUE, "cell extents must be positive: " + latExtent + " x " + lonExtent);
        }
        if (!coverage.contains(lat, lon)) {
            throw outOfCoverage(lat, lon);
        }

        Unit unit = unit(unitText);
        requireNonNegative(value);
        Unit columnUnit = UnitConversions.columnUnit(unit);
        double factor = conversions.factor(pollutant, columnUnit)
                .orElseThrow(() -> UnitConversions.incompatible(pollutant, unit, "satellite retrievals"));
        double canonical = UnitConversions.toColumnUnit(value, unit) * factor;
        return new Measurement(
                SourceKind.SATELLITE,
                pollutant,
                canonical,
                Unit.MICROGRAMS_PER_CUBIC_METER,
                center,
                timestamp,
                SpatialResolution.cell(latExtent, lonExtent)
        );
    }

    private static Pollutant pollutant(String code) {
        String value = required(code, "pollutant");
        return Pollutant.fromCode(value)
                .orElseThrow(() -> new SchemaException(SchemaReason.UNKNOWN_POLLUTANT, "unrecognized pollutant '" + value + "'"));
    }

    private static Unit unit(String text) {
        return Unit.parse(text)
                .orElseThrow(() -> new SchemaException(SchemaReason.UNKNOWN_UNIT, "unrecognized unit '" + text + "'"));
    }

    private static Location location(double lat, double lon) {
        if (!Location.isValid(lat, lon)) {
            throw new SchemaException(SchemaReason.INVALID_VALUE, "coordinates out of range: " + lat + ", " + lon);
        }
        return new Location(lat, lon);
    }

    private static void requireNonNegative(double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw new SchemaException(SchemaReason.INVALID_VALUE, "value must be finite and >= 0: " + value);
        }
    }

    private SchemaException outOfCoverage(double lat, double lon) {
        return new SchemaException(SchemaReason.OUT_OF_COVERAGE, "cell at " + lat + ", " + lon + " is outside " + coverage);
    }

    private static <T> T required(T value, String field) {
        if (value == null) {
            throw SchemaException.missingField(field);
        }
        if (value instanceof String text && text.isBlank()) {
            throw SchemaException.missingField(field);
        }
        return value;
    }
}
