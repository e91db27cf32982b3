package com.airsentinel.service.sample;

import com.airsentinel.core.model.Location;
import com.airsentinel.core.model.Measurement;
import com.airsentinel.core.model.Pollutant;
import com.airsentinel.core.model.SourceKind;
import com.airsentinel.core.model.SpatialResolution;
import com.airsentinel.core.model.Unit;
import com.airsentinel.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class SampleDataset {
    public static final String DEFAULT_RESOURCE = "sample/bangkok.json";

    private final String name;
    private final Location location;
    private final List<Measurement> measurements;

    private SampleDataset(String name, Location location, List<Measurement> measurements) {
        this.name = name;
        this.location = location;
        this.measurements = List.copyOf(measurements);
    }

    public static SampleDataset loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public static SampleDataset loadResource(String resource) {
        try (InputStream in = SampleDataset.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Sample dataset not found on classpath: " + resource);
            }
            return read(in, resource);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed reading sample dataset: " + resource, e);
        }
    }

    public static SampleDataset load(Path jsonFile) {
        try (InputStream in = Files.newInputStream(jsonFile)) {
            return read(in, jsonFile.toString());
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed reading sample dataset: " + jsonFile, e);
        }
    }

    public String name() {
        return name;
    }

    public Location location() {
        return location;
    }

    public List<Measurement> measurements() {
        return measurements;
    }

    private static SampleDataset read(InputStream in, String origin) throws IOException {
        SampleFile file = JsonUtils.objectMapper().readValue(in, SampleFile.class);
        if (file.location() == null || file.measurements() == null) {
            throw new IllegalArgumentException("Sample dataset " + origin + " needs a location and measurements");
        }
        List<Measurement> measurements = new ArrayList<>(file.measurements().size());
        for (int i = 0; i < file.measurements().size(); i++) {
            try {
                measurements.add(file.measurements().get(i).toMeasurement());
            } catch (RuntimeException e) {
                throw new IllegalArgumentException("Invalid entry " + i + " in sample dataset " + origin + ": " + e.getMessage(), e);
            }
        }
        String name = file.name() == null ? origin : file.name();
        return new SampleDataset(name, file.location(), measurements);
    }

    private record SampleFile(String name, Location location, List<SampleEntry> measurements) {
    }

    private record SampleEntry(
            String source,
            String pollutant,
            double value,
            String unit,
            double latitude,
            double longitude,
            Instant timestamp,
            Double latExtentDeg,
            Double lonExtentDeg
    ) {
        Measurement toMeasurement() {
            SourceKind kind = SourceKind.valueOf(source.trim().toUpperCase(Locale.ROOT));
            Pollutant parsedPollutant = Pollutant.fromCode(pollutant)
                    .orElseThrow(() -> new IllegalArgumentException("unknown pollutant " + pollutant));
            Unit parsedUnit = Unit.parse(unit)
                    .orElseThrow(() -> new IllegalArgumentException("unknown unit " + unit));
            SpatialResolution resolution = kind == SourceKind.SATELLITE
                    ? SpatialResolution.cell(latExtentDeg, lonExtentDeg)
                    : SpatialResolution.point();
            return new Measurement(kind, parsedPollutant, value, parsedUnit, new Location(latitude, longitude), timestamp, resolution);
        }
    }
}
