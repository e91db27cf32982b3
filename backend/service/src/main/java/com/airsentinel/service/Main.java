package com.airsentinel.service;

import com.airsentinel.core.bus.EventBus;
import com.airsentinel.core.events.AqiAlertRaised;
import com.airsentinel.core.model.Measurement;
import com.airsentinel.core.model.Pollutant;
import com.airsentinel.core.model.TimeWindow;
import com.airsentinel.core.util.JsonUtils;
import com.airsentinel.service.config.ConfigLoader;
import com.airsentinel.service.config.EngineConfig;
import com.airsentinel.service.query.AirQualityQueryService;
import com.airsentinel.service.query.QueryResult;
import com.airsentinel.service.sample.SampleDataset;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) {
        SampleDataset dataset = args.length > 0 ? SampleDataset.load(Path.of(args[0])) : SampleDataset.loadDefault();
        run(Path.of("config"), dataset, Clock.systemUTC(), System.out);
    }

    static QueryResult run(Path configDir, SampleDataset dataset, Clock clock, PrintStream out) {
        EngineConfig config = resolveConfig(configDir);
        EventBus eventBus = new EventBus();
        eventBus.subscribe(AqiAlertRaised.class, event -> LOGGER.info(
                "Alert: " + event.alert().pollutant().code() + " " + event.alert().category().wireName()
                        + " (" + event.alert().reason().wireName() + ") at " + event.alert().triggeredAt()));

        AirQualityQueryService service = AirQualityQueryService.create(config, eventBus, clock);
        service.loadSample(dataset);
        QueryResult result = service.query(dataset.location(), EnumSet.allOf(Pollutant.class), coveringWindow(dataset.measurements()),
                config.defaultHorizonSteps());
        out.println(JsonUtils.toJson(result));
        return result;
    }

    static EngineConfig resolveConfig(Path configDir) {
        if (Files.exists(configDir.resolve("engine.json"))) {
            return ConfigLoader.loadEngine(configDir);
        }
        LOGGER.info("No engine.json in " + configDir.toAbsolutePath() + "; using defaults.");
        return EngineConfig.defaults();
    }

    static TimeWindow coveringWindow(List<Measurement> measurements) {
        if (measurements.isEmpty()) {
            throw new IllegalArgumentException("Sample dataset has no measurements");
        }
        Instant first = measurements.stream().map(Measurement::timestamp).min(Comparator.naturalOrder()).orElseThrow();
        Instant last = measurements.stream().map(Measurement::timestamp).max(Comparator.naturalOrder()).orElseThrow();
        return new TimeWindow(first.truncatedTo(ChronoUnit.HOURS), last.truncatedTo(ChronoUnit.HOURS).plus(1, ChronoUnit.HOURS));
    }
}
