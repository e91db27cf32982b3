package com.airsentinel.harmonizer.align;

import com.airsentinel.core.model.JointSample;
import com.airsentinel.core.model.JointSeries;
import com.airsentinel.core.model.Location;
import com.airsentinel.core.model.Measurement;
import com.airsentinel.core.model.Pollutant;
import com.airsentinel.core.model.SampleStatus;
import com.airsentinel.core.model.SourceKind;
import com.airsentinel.core.model.TimeSeries;
import com.airsentinel.core.model.TimeWindow;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.airsentinel.harmonizer.support.Fixtures.BANGKOK;
import static com.airsentinel.harmonizer.support.Fixtures.HOUR;
import static com.airsentinel.harmonizer.support.Fixtures.T0;
import static com.airsentinel.harmonizer.support.Fixtures.ground;
import static com.airsentinel.harmonizer.support.Fixtures.hour;
import static com.airsentinel.harmonizer.support.Fixtures.satellite;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpatiotemporalAlignerTest {
    private final SpatiotemporalAligner aligner = new SpatiotemporalAligner(AlignerSettings.defaults());

    @Test
    void groundAndSatelliteInSameBucketBlendTowardGround() {
        TimeSeries groundSeries = groundSeries(ground(Pollutant.PM25, 40.0, BANGKOK, T0), ground(Pollutant.PM25, 50.0, BANGKOK, hour(2)));
        TimeSeries satelliteSeries = satelliteSeries(satellite(Pollutant.PM25, 60.0, new Location(13.75, 100.55), 0.25, T0));

        JointSeries joint = aligner.align(BANGKOK, Pollutant.PM25, TimeWindow.of(T0, Duration.ofHours(3)), groundSeries, satelliteSeries);

        JointSample first = joint.samples().get(0);
        assertEquals(SampleStatus.OBSERVED, first.status());
        // reading sits 30 min from the bucket midpoint: w_ground = 1 - 0.5h / 2h
        assertEquals(0.75, first.groundWeight(), 1e-12);
        assertEquals(0.25, first.satelliteWeight(), 1e-12);
        assertEquals(45.0, first.value(), 1e-9);
        assertTrue(first.value() >= 42.0 && first.value() <= 46.0);

        JointSample second = joint.samples().get(1);
        assertEquals(SampleStatus.IMPUTED, second.status());
        assertEquals(47.5, second.value(), 1e-9);
        assertEquals(0.0, second.groundWeight());

        JointSample third = joint.samples().get(2);
        assertEquals(50.0, third.value(), 1e-9);
        assertEquals(1.0, third.groundWeight());
    }

    @Test
    void satelliteFillsBucketsWithoutGround() {
        TimeSeries satelliteSeries = satelliteSeries(satellite(Pollutant.NO2, 30.0, new Location(13.75, 100.55), 0.25, hour(1)));

        JointSeries joint = aligner.align(BANGKOK, Pollutant.NO2, TimeWindow.of(T0, Duration.ofHours(2)),
                TimeSeries.empty(Pollutant.NO2, SourceKind.GROUND), satelliteSeries);

        assertEquals(SampleStatus.MISSING, joint.samples().get(0).status());
        JointSample filled = joint.samples().get(1);
        assertEquals(30.0, filled.value());
        assertEquals(1.0, filled.satelliteWeight());
        assertEquals(0.0, filled.groundWeight());
    }

    @Test
    void boundaryGapsStayMissingInsteadOfZero() {
        TimeSeries groundSeries = groundSeries(ground(Pollutant.O3, 80.0, BANGKOK, hour(2)), ground(Pollutant.O3, 90.0, BANGKOK, hour(3)));

        JointSeries joint = aligner.align(BANGKOK, Pollutant.O3, TimeWindow.of(T0, Duration.ofHours(6)), groundSeries,
                TimeSeries.empty(Pollutant.O3, SourceKind.SATELLITE));

        assertEquals(6, joint.samples().size());
        for (int i : new int[]{0, 1, 4, 5}) {
            JointSample sample = joint.samples().get(i);
            assertEquals(SampleStatus.MISSING, sample.status());
            assertNull(sample.value());
        }
        assertEquals(2, joint.count(SampleStatus.OBSERVED));
        assertEquals(hour(3), joint.latestPresent().orElseThrow().bucketStart());
    }

    @Test
    void satelliteCellsNotCoveringLocationAreIgnored() {
        TimeSeries satelliteSeries = satelliteSeries(satellite(Pollutant.NO2, 30.0, new Location(14.5, 101.5), 0.25, T0));

        JointSeries joint = aligner.align(BANGKOK, Pollutant.NO2, TimeWindow.of(T0, HOUR), TimeSeries.empty(Pollutant.NO2, SourceKind.GROUND), satelliteSeries);

        assertEquals(SampleStatus.MISSING, joint.samples().get(0).status());
    }

    @Test
    void readingsBeyondToleranceOfMidpointAreNotUsed() {
        SpatiotemporalAligner strict = new SpatiotemporalAligner(
                new AlignerSettings(Duration.ofHours(1), Duration.ofMinutes(20), Duration.ofMinutes(20)));
        TimeSeries groundSeries = groundSeries(
                ground(Pollutant.PM25, 10.0, BANGKOK, T0),
                ground(Pollutant.PM25, 20.0, BANGKOK, hour(1).plus(Duration.ofMinutes(25))),
                ground(Pollutant.PM25, 30.0, BANGKOK, hour(2).plus(Duration.ofMinutes(30))));

        JointSeries joint = strict.align(BANGKOK, Pollutant.PM25, TimeWindow.of(T0, Duration.ofHours(3)), groundSeries,
                TimeSeries.empty(Pollutant.PM25, SourceKind.SATELLITE));

        assertEquals(SampleStatus.MISSING, joint.samples().get(0).status());
        assertEquals(20.0, joint.samples().get(1).value());
        assertEquals(30.0, joint.samples().get(2).value());
    }

    @Test
    void nearestReadingToMidpointWinsWithinBucket() {
        TimeSeries groundSeries = groundSeries(
                ground(Pollutant.PM25, 10.0, BANGKOK, T0.plus(Duration.ofMinutes(5))),
                ground(Pollutant.PM25, 20.0, BANGKOK, T0.plus(Duration.ofMinutes(25))),
                ground(Pollutant.PM25, 30.0, BANGKOK, T0.plus(Duration.ofMinutes(35))));

        JointSeries joint = aligner.align(BANGKOK, Pollutant.PM25, TimeWindow.of(T0, HOUR), groundSeries,
                TimeSeries.empty(Pollutant.PM25, SourceKind.SATELLITE));

        // 25 and 35 minutes are equally distant from the midpoint; the earlier reading is kept
        assertEquals(20.0, joint.samples().get(0).value());
    }

    @Test
    void partialTrailingBucketIsIncluded() {
        JointSeries joint = aligner.align(BANGKOK, Pollutant.PM25, TimeWindow.of(T0, Duration.ofMinutes(150)),
                TimeSeries.empty(Pollutant.PM25, SourceKind.GROUND), TimeSeries.empty(Pollutant.PM25, SourceKind.SATELLITE));

        assertEquals(3, joint.samples().size());
        assertEquals(hour(2), joint.samples().get(2).bucketStart());
    }

    @Test
    void alignmentIsDeterministic() {
        TimeSeries groundSeries = groundSeries(
                ground(Pollutant.PM25, 12.0, BANGKOK, T0.plus(Duration.ofMinutes(10))),
                ground(Pollutant.PM25, 18.5, BANGKOK, hour(3).plus(Duration.ofMinutes(50))),
                ground(Pollutant.PM25, 22.25, BANGKOK, hour(6)));
        TimeSeries satelliteSeries = satelliteSeries(
                satellite(Pollutant.PM25, 31.0, new Location(13.75, 100.55), 0.25, hour(3).plus(Duration.ofMinutes(20))),
                satellite(Pollutant.PM25, 27.0, new Location(13.75, 100.55), 0.25, hour(5)));
        TimeWindow window = TimeWindow.of(T0, Duration.ofHours(8));

        JointSeries first = aligner.align(BANGKOK, Pollutant.PM25, window, groundSeries, satelliteSeries);
        JointSeries second = new SpatiotemporalAligner(AlignerSettings.defaults())
                .align(BANGKOK, Pollutant.PM25, window, groundSeries, satelliteSeries);

        assertEquals(first, second);
        for (int i = 0; i < first.samples().size(); i++) {
            JointSample a = first.samples().get(i);
            JointSample b = second.samples().get(i);
            if (a.value() != null) {
                assertEquals(Double.doubleToRawLongBits(a.value()), Double.doubleToRawLongBits(b.value()));
            }
        }
    }

    @Test
    void mismatchedSeriesAreRejected() {
        TimeSeries no2 = TimeSeries.empty(Pollutant.NO2, SourceKind.GROUND);

        assertThrows(IllegalArgumentException.class, () -> aligner.align(BANGKOK, Pollutant.PM25, TimeWindow.of(T0, HOUR), no2,
                TimeSeries.empty(Pollutant.PM25, SourceKind.SATELLITE)));
        assertThrows(IllegalArgumentException.class, () -> aligner.align(BANGKOK, Pollutant.NO2, TimeWindow.of(T0, HOUR), no2,
                TimeSeries.empty(Pollutant.NO2, SourceKind.GROUND)));
    }

    private static TimeSeries groundSeries(Measurement... measurements) {
        return TimeSeries.sorted(measurements[0].pollutant(), SourceKind.GROUND, List.of(measurements));
    }

    private static TimeSeries satelliteSeries(Measurement... measurements) {
        return TimeSeries.sorted(measurements[0].pollutant(), SourceKind.SATELLITE, List.of(measurements));
    }
}
