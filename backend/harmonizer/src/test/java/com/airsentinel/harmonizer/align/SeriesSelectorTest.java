package com.airsentinel.harmonizer.align;

import com.airsentinel.core.model.Location;
import com.airsentinel.core.model.Measurement;
import com.airsentinel.core.model.Pollutant;
import com.airsentinel.core.model.TimeSeries;
import com.airsentinel.core.model.TimeWindow;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.airsentinel.harmonizer.support.Fixtures.BANGKOK;
import static com.airsentinel.harmonizer.support.Fixtures.T0;
import static com.airsentinel.harmonizer.support.Fixtures.ground;
import static com.airsentinel.harmonizer.support.Fixtures.hour;
import static com.airsentinel.harmonizer.support.Fixtures.satellite;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SeriesSelectorTest {
    private static final TimeWindow WINDOW = TimeWindow.of(T0, Duration.ofHours(6));
    private static final Location NEAR = new Location(13.75, 100.55);
    private static final Location FURTHER = new Location(13.78, 100.58);
    private static final Location OUTSIDE_RADIUS = new Location(14.2, 100.9);

    private final SeriesSelector selector = new SeriesSelector(10.0);

    @Test
    void nearestStationWithinRadiusIsChosen() {
        List<Measurement> pool = List.of(
                ground(Pollutant.PM25, 30.0, FURTHER, hour(0)),
                ground(Pollutant.PM25, 31.0, FURTHER, hour(1)),
                ground(Pollutant.PM25, 20.0, NEAR, hour(1)),
                ground(Pollutant.PM25, 21.0, NEAR, hour(0)),
                ground(Pollutant.PM25, 5.0, OUTSIDE_RADIUS, hour(0))
        );

        TimeSeries series = selector.groundSeries(BANGKOK, Pollutant.PM25, WINDOW, pool);

        assertEquals(2, series.size());
        assertEquals(21.0, series.measurements().get(0).value());
        assertEquals(20.0, series.measurements().get(1).value());
        assertTrue(series.measurements().stream().allMatch(m -> m.location().equals(NEAR)));
    }

    @Test
    void groundSeriesIgnoresOtherPollutantsAndReadingsOutsideWindow() {
        List<Measurement> pool = List.of(
                ground(Pollutant.NO2, 40.0, NEAR, hour(0)),
                ground(Pollutant.PM25, 12.0, NEAR, hour(6)),
                ground(Pollutant.PM25, 11.0, NEAR, T0.minusSeconds(1))
        );

        assertTrue(selector.groundSeries(BANGKOK, Pollutant.PM25, WINDOW, pool).isEmpty());
    }

    @Test
    void noStationWithinRadiusYieldsEmptySeries() {
        List<Measurement> pool = List.of(ground(Pollutant.PM25, 5.0, OUTSIDE_RADIUS, hour(0)));

        assertTrue(selector.groundSeries(BANGKOK, Pollutant.PM25, WINDOW, pool).isEmpty());
    }

    @Test
    void redeliveredReadingReplacesEarlierOne() {
        List<Measurement> pool = List.of(
                ground(Pollutant.PM25, 20.0, NEAR, hour(0)),
                ground(Pollutant.PM25, 22.0, NEAR, hour(0))
        );

        TimeSeries series = selector.groundSeries(BANGKOK, Pollutant.PM25, WINDOW, pool);

        assertEquals(1, series.size());
        assertEquals(22.0, series.measurements().get(0).value());
    }

    @Test
    void redeliveredSatelliteCellReplacesEarlierOne() {
        List<Measurement> pool = List.of(
                satellite(Pollutant.NO2, 30.0, NEAR, 0.25, hour(0)),
                satellite(Pollutant.NO2, 70.0, NEAR, 0.25, hour(0))
        );

        TimeSeries series = selector.satelliteSeries(BANGKOK, Pollutant.NO2, WINDOW, pool);

        assertEquals(1, series.size());
        assertEquals(70.0, series.measurements().get(0).value());
    }

    @Test
    void finestCoveringCellWinsPerTimestamp() {
        List<Measurement> pool = List.of(
                satellite(Pollutant.NO2, 50.0, new Location(13.5, 100.5), 1.0, hour(1)),
                satellite(Pollutant.NO2, 35.0, NEAR, 0.25, hour(1)),
                satellite(Pollutant.NO2, 90.0, new Location(15.0, 102.0), 0.25, hour(1)),
                satellite(Pollutant.NO2, 44.0, new Location(13.5, 100.5), 1.0, hour(0))
        );

        TimeSeries series = selector.satelliteSeries(BANGKOK, Pollutant.NO2, WINDOW, pool);

        assertEquals(2, series.size());
        assertEquals(hour(0), series.measurements().get(0).timestamp());
        assertEquals(44.0, series.measurements().get(0).value());
        assertEquals(35.0, series.measurements().get(1).value());
    }

    @Test
    void radiusMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new SeriesSelector(0.0));
        assertThrows(IllegalArgumentException.class, () -> new SeriesSelector(Double.NaN));
    }
}
