package com.airsentinel.harmonizer.normalize;

import com.airsentinel.core.error.SchemaException;
import com.airsentinel.core.error.SchemaReason;
import com.airsentinel.core.model.SourceKind;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Reads the two sources' JSON payloads into raw records without judging them; absent fields come
 * back as {@code null} so the {@link Normalizer} can report them.
 * <p>
 * Ground: {@code {"parameter": "pm25" | {"name": "pm25", "units": "µg/m³"}, "value": 12.3, "unit": "µg/m³",
 * "coordinates": {"latitude": .., "longitude": ..}, "date": {"utc": "2026-03-01T00:00:00Z"}}}.
 * <p>
 * Satellite: {@code {"product": "S5P_L2_NO2", "parameter": "no2", "column_density": 1.2e-4, "unit": "mol/m2",
 * "cell": {"center_lat": .., "center_lon": .., "lat_extent": .., "lon_extent": ..}, "time": "..."}}.
 */
public final class RawRecordCodec {
    private RawRecordCodec() {
    }

    public static RawRecord parse(JsonNode node, SourceKind kind) {
        if (node == null || !node.isObject()) {
            throw new SchemaException(SchemaReason.INVALID_VALUE, "payload must be a JSON object");
        }
        return kind == SourceKind.GROUND ? parseGround(node) : parseSatellite(node);
    }

    public static List<RawRecord> parseAll(JsonNode array, SourceKind kind, Consumer<SchemaException> onRejected) {
        if (array == null || !array.isArray()) {
            throw new IllegalArgumentException("Expected a JSON array of " + kind + " records");
        }
        List<RawRecord> records = new ArrayList<>();
        for (JsonNode element : array) {
            try {
                records.add(parse(element, kind));
            } catch (SchemaException e) {
                onRejected.accept(e);
            }
        }
        return records;
    }

    private static RawGroundRecord parseGround(JsonNode node) {
        JsonNode parameter = node.path("parameter");
        String pollutant;
        String unit = text(node, "unit");
        if (parameter.isObject()) {
            pollutant = text(parameter, "name");
            if (unit == null) {
                unit = text(parameter, "units");
            }
        } else {
            pollutant = text(node, "parameter");
        }
        JsonNode coordinates = node.path("coordinates");
        JsonNode date = node.path("date");
        String utc = date.isObject() ? text(date, "utc") : text(node, "date");
        return new RawGroundRecord(
                pollutant,
                number(node, "value"),
                unit,
                number(coordinates, "latitude"),
                number(coordinates, "longitude"),
                instant(utc)
        );
    }

    private static RawSatelliteRecord parseSatellite(JsonNode node) {
        JsonNode cell = node.path("cell");
        return new RawSatelliteRecord(
                text(node, "product"),
                text(node, "parameter"),
                number(node, "column_density"),
                text(node, "unit"),
                number(cell, "center_lat"),
                number(cell, "center_lon"),
                number(cell, "lat_extent"),
                number(cell, "lon_extent"),
                instant(text(node, "time"))
        );
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull() || !value.isValueNode()) {
            return null;
        }
        return value.asText();
    }

    private static Double number(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        if (!value.isNumber()) {
            throw new SchemaException(SchemaReason.INVALID_VALUE, "field '" + field + "' must be numeric");
        }
        return value.doubleValue();
    }

    private static Instant instant(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new SchemaException(SchemaReason.INVALID_VALUE, "timestamp '" + text + "' is not ISO-8601 UTC", e);
        }
    }
}
