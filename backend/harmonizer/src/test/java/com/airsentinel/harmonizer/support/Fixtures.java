package com.airsentinel.harmonizer.support;

import com.airsentinel.core.model.JointSample;
import com.airsentinel.core.model.JointSeries;
import com.airsentinel.core.model.Location;
import com.airsentinel.core.model.Measurement;
import com.airsentinel.core.model.Pollutant;
import com.airsentinel.core.model.SourceKind;
import com.airsentinel.core.model.SpatialResolution;
import com.airsentinel.core.model.TimeWindow;
import com.airsentinel.core.model.Unit;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class Fixtures {
    public static final Instant T0 = Instant.parse("2026-03-01T00:00:00Z");
    public static final Location BANGKOK = new Location(13.74433, 100.54365);
    public static final Duration HOUR = Duration.ofHours(1);

    private Fixtures() {
    }

    public static Path fixturePath(String relativePath) {
        URL resource = Fixtures.class.getClassLoader().getResource(relativePath);
        if (resource == null) {
            throw new IllegalArgumentException("Fixture not found: " + relativePath);
        }
        try {
            return Path.of(resource.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Invalid fixture URI: " + relativePath, e);
        }
    }

    public static Instant hour(int offset) {
        return T0.plus(HOUR.multipliedBy(offset));
    }

    public static Measurement ground(Pollutant pollutant, double value, Location location, Instant at) {
        return new Measurement(SourceKind.GROUND, pollutant, value, Unit.MICROGRAMS_PER_CUBIC_METER, location, at, SpatialResolution.point());
    }

    public static Measurement satellite(Pollutant pollutant, double value, Location cellCenter, double extentDeg, Instant at) {
        return new Measurement(SourceKind.SATELLITE, pollutant, value, Unit.MICROGRAMS_PER_CUBIC_METER, cellCenter, at,
                SpatialResolution.cell(extentDeg, extentDeg));
    }

    public static JointSeries observedSeries(Pollutant pollutant, Double... values) {
        List<JointSample> samples = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            samples.add(values[i] == null
                    ? JointSample.missing(hour(i))
                    : JointSample.observed(hour(i), values[i], 1.0, 0.0));
        }
        return new JointSeries(BANGKOK, pollutant, TimeWindow.of(T0, HOUR.multipliedBy(values.length)), HOUR, samples);
    }

    public static JointSeries series(Pollutant pollutant, List<JointSample> samples) {
        return new JointSeries(BANGKOK, pollutant, TimeWindow.of(T0, HOUR.multipliedBy(samples.size())), HOUR, samples);
    }
}
