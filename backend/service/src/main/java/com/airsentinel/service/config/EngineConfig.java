package com.airsentinel.service.config;

import com.airsentinel.core.model.Location;
import com.airsentinel.core.model.Pollutant;
import com.airsentinel.harmonizer.align.AlignerSettings;
import com.airsentinel.harmonizer.classify.BreakpointTable;
import com.airsentinel.harmonizer.forecast.ForecastSettings;
import com.airsentinel.harmonizer.normalize.CoverageBox;
import com.airsentinel.harmonizer.normalize.SatelliteConversions;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

public record EngineConfig(
        Duration bucketWidth,
        Duration groundTolerance,
        Duration satelliteTolerance,
        double searchRadiusKm,
        int minHistory,
        double confidenceLevel,
        double imputedWeight,
        double levelSmoothing,
        double trendSmoothing,
        int defaultHorizonSteps,
        Duration cacheTtl,
        Location defaultLocation,
        CoverageBox coverage,
        Map<String, Breakpoints> breakpoints,
        Map<String, Double> columnFactors,
        Map<String, Double> aodFactors
) {
    public EngineConfig {
        breakpoints = Map.copyOf(breakpoints);
        columnFactors = Map.copyOf(columnFactors);
        aodFactors = Map.copyOf(aodFactors);
    }

    public record Breakpoints(double moderateFrom, double unhealthyFrom) {
    }

    public static EngineConfig defaults() {
        AlignerSettings aligner = AlignerSettings.defaults();
        ForecastSettings forecast = ForecastSettings.defaults();
        SatelliteConversions conversions = SatelliteConversions.defaults();
        Map<String, Breakpoints> breakpoints = new LinkedHashMap<>();
        breakpoints.put(Pollutant.PM25.code(), new Breakpoints(12.1, 55.5));
        breakpoints.put(Pollutant.NO2.code(), new Breakpoints(101.6, 678.7));
        breakpoints.put(Pollutant.O3.code(), new Breakpoints(107.8, 168.6));
        return new EngineConfig(
                aligner.bucketWidth(),
                aligner.groundTolerance(),
                aligner.satelliteTolerance(),
                10.0,
                forecast.minHistory(),
                forecast.confidenceLevel(),
                forecast.imputedWeight(),
                forecast.levelSmoothing(),
                forecast.trendSmoothing(),
                24,
                Duration.ofMinutes(10),
                new Location(13.74433, 100.54365),
                CoverageBox.defaults(),
                breakpoints,
                byCode(conversions.columnFactors()),
                byCode(conversions.aodFactors())
        );
    }

    public AlignerSettings alignerSettings() {
        return new AlignerSettings(bucketWidth, groundTolerance, satelliteTolerance);
    }

    public ForecastSettings forecastSettings() {
        return new ForecastSettings(minHistory, confidenceLevel, imputedWeight, levelSmoothing, trendSmoothing);
    }

    public SatelliteConversions satelliteConversions() {
        return new SatelliteConversions(byPollutant(columnFactors), byPollutant(aodFactors));
    }

    public Map<Pollutant, BreakpointTable> breakpointTables() {
        Map<Pollutant, BreakpointTable> tables = new EnumMap<>(Pollutant.class);
        breakpoints.forEach((code, table) -> tables.put(pollutant(code), new BreakpointTable(table.moderateFrom(), table.unhealthyFrom())));
        return tables;
    }

    void validate() {
        alignerSettings();
        forecastSettings();
        satelliteConversions();
        breakpointTables();
        if (!(searchRadiusKm > 0.0)) {
            throw new IllegalArgumentException("searchRadiusKm must be positive: " + searchRadiusKm);
        }
        if (defaultHorizonSteps < 1) {
            throw new IllegalArgumentException("defaultHorizonSteps must be >= 1: " + defaultHorizonSteps);
        }
        if (cacheTtl == null || cacheTtl.isNegative()) {
            throw new IllegalArgumentException("cacheTtl must not be negative: " + cacheTtl);
        }
    }

    private static Map<String, Double> byCode(Map<Pollutant, Double> factors) {
        Map<String, Double> byCode = new LinkedHashMap<>();
        factors.forEach((pollutant, factor) -> byCode.put(pollutant.code(), factor));
        return byCode;
    }

    private static Map<Pollutant, Double> byPollutant(Map<String, Double> factors) {
        Map<Pollutant, Double> byPollutant = new EnumMap<>(Pollutant.class);
        factors.forEach((code, factor) -> byPollutant.put(pollutant(code), factor));
        return byPollutant;
    }

    private static Pollutant pollutant(String code) {
        return Pollutant.fromCode(code)
                .orElseThrow(() -> new IllegalArgumentException("Unknown pollutant in config: " + code));
    }
}
