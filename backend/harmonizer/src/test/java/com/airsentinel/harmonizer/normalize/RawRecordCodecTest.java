package com.airsentinel.harmonizer.normalize;

import com.airsentinel.core.error.SchemaException;
import com.airsentinel.core.error.SchemaReason;
import com.airsentinel.core.model.Measurement;
import com.airsentinel.core.model.Pollutant;
import com.airsentinel.core.model.SourceKind;
import com.airsentinel.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.airsentinel.harmonizer.support.Fixtures.fixturePath;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RawRecordCodecTest {
    @Test
    void parsesGroundPayloadsInBothParameterShapes() throws Exception {
        JsonNode payload = JsonUtils.readTree(Files.readString(fixturePath("fixtures/ground-records.json")));
        List<SchemaException> rejected = new ArrayList<>();

        List<RawRecord> records = RawRecordCodec.parseAll(payload, SourceKind.GROUND, rejected::add);

        assertEquals(3, records.size());
        assertEquals(1, rejected.size());
        assertEquals(SchemaReason.INVALID_VALUE, rejected.get(0).schemaReason());

        RawGroundRecord first = assertInstanceOf(RawGroundRecord.class, records.get(0));
        assertEquals("pm25", first.pollutant());
        assertEquals(18.4, first.value());
        assertEquals(Instant.parse("2026-03-01T00:00:00Z"), first.timestamp());

        RawGroundRecord nested = assertInstanceOf(RawGroundRecord.class, records.get(1));
        assertEquals("no2", nested.pollutant());
        assertEquals("ppb", nested.unit());
    }

    @Test
    void missingDateSurfacesAsMissingFieldDuringNormalization() throws Exception {
        JsonNode payload = JsonUtils.readTree(Files.readString(fixturePath("fixtures/ground-records.json")));
        List<RawRecord> records = RawRecordCodec.parseAll(payload, SourceKind.GROUND, ignored -> {
        });

        RawGroundRecord undated = (RawGroundRecord) records.get(2);
        assertNull(undated.timestamp());
        SchemaException error = assertThrows(SchemaException.class, () -> new Normalizer().normalize(undated));
        assertEquals(SchemaReason.MISSING_FIELD, error.schemaReason());
    }

    @Test
    void parsesSatellitePayloadAndRejectsBadTimestamp() throws Exception {
        JsonNode payload = JsonUtils.readTree(Files.readString(fixturePath("fixtures/satellite-records.json")));
        List<SchemaException> rejected = new ArrayList<>();

        List<RawRecord> records = RawRecordCodec.parseAll(payload, SourceKind.SATELLITE, rejected::add);

        assertEquals(1, records.size());
        assertEquals(1, rejected.size());
        RawSatelliteRecord cell = assertInstanceOf(RawSatelliteRecord.class, records.get(0));
        assertEquals("S5P_L2_NO2", cell.product());
        assertEquals(0.1, cell.cellLatExtent());

        Measurement m = new Normalizer().normalize(cell);
        assertEquals(Pollutant.NO2, m.pollutant());
        assertEquals(1.2e-4 * 46005.5, m.value(), 1e-6);
    }

    @Test
    void nonObjectElementsAreRejectedAndNonArraysFailFast() {
        List<SchemaException> rejected = new ArrayList<>();
        List<RawRecord> records = RawRecordCodec.parseAll(JsonUtils.readTree("[1, \"x\"]"), SourceKind.GROUND, rejected::add);

        assertEquals(0, records.size());
        assertEquals(2, rejected.size());
        assertThrows(IllegalArgumentException.class,
                () -> RawRecordCodec.parseAll(JsonUtils.readTree("{}"), SourceKind.GROUND, rejected::add));
    }
}
