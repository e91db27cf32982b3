package com.airsentinel.harmonizer.align;

import com.airsentinel.core.model.JointSample;
import com.airsentinel.core.model.JointSeries;
import com.airsentinel.core.model.Location;
import com.airsentinel.core.model.Measurement;
import com.airsentinel.core.model.Pollutant;
import com.airsentinel.core.model.SourceKind;
import com.airsentinel.core.model.TimeSeries;
import com.airsentinel.core.model.TimeWindow;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resamples a ground series and a satellite series onto fixed buckets covering the query window.
 * <p>
 * An observation may only serve the bucket containing its timestamp, and only when it lies within
 * the source's tolerance of that bucket's midpoint. When both sources serve a bucket the ground
 * weight is {@code clamp(1 - age / τ_g, 0, 1)} and the satellite takes the rest. Gaps between
 * populated buckets are linearly interpolated and flagged imputed; gaps at either end stay missing.
 * The output depends only on the arguments.
 */
public final class SpatiotemporalAligner {
    private final AlignerSettings settings;

    public SpatiotemporalAligner(AlignerSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings is required");
    }

    public JointSeries align(
            Location location,
            Pollutant pollutant,
            TimeWindow window,
            TimeSeries ground,
            TimeSeries satellite
    ) {
        Objects.requireNonNull(location, "location is required");
        requireSeries(ground, pollutant, SourceKind.GROUND);
        requireSeries(satellite, pollutant, SourceKind.SATELLITE);

        Duration width = settings.bucketWidth();
        int buckets = bucketCount(window, width);
        Measurement[] groundPick = pick(ground, window, buckets, settings.groundTolerance(), null);
        Measurement[] satellitePick = pick(satellite, window, buckets, settings.satelliteTolerance(), location);

        Double[] values = new Double[buckets];
        double[] groundWeights = new double[buckets];
        for (int i = 0; i < buckets; i++) {
            Measurement g = groundPick[i];
            Measurement s = satellitePick[i];
            if (g != null && s != null) {
                double wGround = groundWeight(age(g, midpoint(window, i)));
                groundWeights[i] = wGround;
                values[i] = wGround * g.value() + (1.0 - wGround) * s.value();
            } else if (g != null) {
                groundWeights[i] = 1.0;
                values[i] = g.value();
            } else if (s != null) {
                groundWeights[i] = 0.0;
                values[i] = s.value();
            }
        }

        List<JointSample> samples = new ArrayList<>(buckets);
        int previous = -1;
        for (int i = 0; i < buckets; i++) {
            Instant bucketStart = bucketStart(window, i);
            if (values[i] != null) {
                samples.add(JointSample.observed(bucketStart, values[i], groundWeights[i], 1.0 - groundWeights[i]));
                previous = i;
                continue;
            }
            int next = nextPopulated(values, i + 1);
            if (previous < 0 || next < 0) {
                samples.add(JointSample.missing(bucketStart));
            } else {
                double fraction = (double) (i - previous) / (next - previous);
                double interpolated = values[previous] + (values[next] - values[previous]) * fraction;
                samples.add(JointSample.imputed(bucketStart, Math.max(0.0, interpolated)));
            }
        }
        return new JointSeries(location, pollutant, window, width, samples);
    }

    static int bucketCount(TimeWindow window, Duration width) {
        Duration length = window.length();
        long whole = length.dividedBy(width);
        boolean partial = !length.minus(width.multipliedBy(whole)).isZero();
        long count = whole + (partial ? 1 : 0);
        if (count > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Window " + window + " has too many buckets of " + width);
        }
        return (int) count;
    }

    private Measurement[] pick(TimeSeries series, TimeWindow window, int buckets, Duration tolerance, Location coveredLocation) {
        Measurement[] picks = new Measurement[buckets];
        for (Measurement m : series.measurements()) {
            if (!window.contains(m.timestamp())) {
                continue;
            }
            if (coveredLocation != null && !m.covers(coveredLocation)) {
                continue;
            }
            int index = (int) Duration.between(window.start(), m.timestamp()).dividedBy(settings.bucketWidth());
            Instant mid = midpoint(window, index);
            Duration age = age(m, mid);
            if (age.compareTo(tolerance) > 0) {
                continue;
            }
            Measurement current = picks[index];
            // series are ascending, so an equally distant later reading never displaces an earlier one
            if (current == null || age.compareTo(age(current, mid)) < 0) {
                picks[index] = m;
            }
        }
        return picks;
    }

    private double groundWeight(Duration age) {
        double ratio = (double) age.toMillis() / settings.groundTolerance().toMillis();
        return Math.max(0.0, Math.min(1.0, 1.0 - ratio));
    }

    private Instant bucketStart(TimeWindow window, int index) {
        return window.start().plus(settings.bucketWidth().multipliedBy(index));
    }

    private Instant midpoint(TimeWindow window, int index) {
        return bucketStart(window, index).plus(settings.bucketWidth().dividedBy(2));
    }

    private static Duration age(Measurement m, Instant reference) {
        return Duration.between(m.timestamp(), reference).abs();
    }

    private static int nextPopulated(Double[] values, int from) {
        for (int i = from; i < values.length; i++) {
            if (values[i] != null) {
                return i;
            }
        }
        return -1;
    }

    private static void requireSeries(TimeSeries series, Pollutant pollutant, SourceKind source) {
        Objects.requireNonNull(series, source + " series is required");
        if (series.pollutant() != pollutant || series.source() != source) {
            throw new IllegalArgumentException(
                    "Expected a " + pollutant + "/" + source + " series but got " + series.pollutant() + "/" + series.source());
        }
    }
}
