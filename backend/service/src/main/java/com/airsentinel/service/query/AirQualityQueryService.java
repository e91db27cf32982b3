package com.airsentinel.service.query;

import com.airsentinel.core.bus.EventBus;
import com.airsentinel.core.error.ClassificationException;
import com.airsentinel.core.error.ForecastException;
import com.airsentinel.core.error.SchemaException;
import com.airsentinel.core.events.AqiAlertRaised;
import com.airsentinel.core.events.MeasurementsIngested;
import com.airsentinel.core.events.QueryCompleted;
import com.airsentinel.core.model.AlertEvent;
import com.airsentinel.core.model.Category;
import com.airsentinel.core.model.ForecastPoint;
import com.airsentinel.core.model.ForecastResult;
import com.airsentinel.core.model.JointSample;
import com.airsentinel.core.model.JointSeries;
import com.airsentinel.core.model.Location;
import com.airsentinel.core.model.Measurement;
import com.airsentinel.core.model.Pollutant;
import com.airsentinel.core.model.SourceKind;
import com.airsentinel.core.model.TimeSeries;
import com.airsentinel.core.model.TimeWindow;
import com.airsentinel.core.util.JsonUtils;
import com.airsentinel.harmonizer.alert.AlertEvaluation;
import com.airsentinel.harmonizer.alert.AlertEvaluator;
import com.airsentinel.harmonizer.alert.AlertKey;
import com.airsentinel.harmonizer.alert.ForecastedCategory;
import com.airsentinel.harmonizer.align.SeriesSelector;
import com.airsentinel.harmonizer.align.SpatiotemporalAligner;
import com.airsentinel.harmonizer.api.MeasurementStore;
import com.airsentinel.harmonizer.classify.AqiClassifier;
import com.airsentinel.harmonizer.forecast.Forecaster;
import com.airsentinel.harmonizer.forecast.WeightedHoltForecaster;
import com.airsentinel.harmonizer.ingest.IngestReport;
import com.airsentinel.harmonizer.ingest.MeasurementIngestor;
import com.airsentinel.harmonizer.normalize.Normalizer;
import com.airsentinel.harmonizer.normalize.RawRecord;
import com.airsentinel.harmonizer.normalize.RawRecordCodec;
import com.airsentinel.service.cache.CacheKey;
import com.airsentinel.service.cache.QueryCache;
import com.airsentinel.service.cache.TtlQueryCache;
import com.airsentinel.service.config.EngineConfig;
import com.airsentinel.service.sample.SampleDataset;
import com.airsentinel.service.state.AlertStateStore;
import com.airsentinel.service.state.InMemoryAlertStateStore;
import com.airsentinel.service.store.InMemoryMeasurementStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

public final class AirQualityQueryService {
    private static final Logger LOGGER = Logger.getLogger(AirQualityQueryService.class.getName());

    private final MeasurementStore store;
    private final MeasurementIngestor ingestor;
    private final SeriesSelector selector;
    private final SpatiotemporalAligner aligner;
    private final AqiClassifier classifier;
    private final Forecaster forecaster;
    private final AlertEvaluator alertEvaluator;
    private final QueryCache cache;
    private final AlertStateStore alertStates;
    private final EventBus eventBus;
    private final Clock clock;

    public AirQualityQueryService(
            MeasurementStore store,
            Normalizer normalizer,
            SeriesSelector selector,
            SpatiotemporalAligner aligner,
            AqiClassifier classifier,
            Forecaster forecaster,
            AlertEvaluator alertEvaluator,
            QueryCache cache,
            AlertStateStore alertStates,
            EventBus eventBus,
            Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.ingestor = new MeasurementIngestor(Objects.requireNonNull(normalizer, "normalizer is required"), store);
        this.selector = Objects.requireNonNull(selector, "selector is required");
        this.aligner = Objects.requireNonNull(aligner, "aligner is required");
        this.classifier = Objects.requireNonNull(classifier, "classifier is required");
        this.forecaster = Objects.requireNonNull(forecaster, "forecaster is required");
        this.alertEvaluator = Objects.requireNonNull(alertEvaluator, "alertEvaluator is required");
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.alertStates = Objects.requireNonNull(alertStates, "alertStates is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public static AirQualityQueryService create(EngineConfig config, EventBus eventBus, Clock clock) {
        return new AirQualityQueryService(
                new InMemoryMeasurementStore(),
                new Normalizer(config.coverage(), config.satelliteConversions()),
                new SeriesSelector(config.searchRadiusKm()),
                new SpatiotemporalAligner(config.alignerSettings()),
                new AqiClassifier(config.breakpointTables()),
                new WeightedHoltForecaster(config.forecastSettings()),
                new AlertEvaluator(),
                new TtlQueryCache(config.cacheTtl(), clock),
                new InMemoryAlertStateStore(),
                eventBus,
                clock
        );
    }

    public IngestReport ingest(Collection<? extends RawRecord> records) {
        return published(ingestor.ingest(records));
    }

    public IngestReport ingestJson(String payload, SourceKind source) {
        List<SchemaException> parseFailures = new ArrayList<>();
        List<RawRecord> records = RawRecordCodec.parseAll(JsonUtils.readTree(payload), source, failure -> {
            LOGGER.warning("Dropped unparseable " + source + " record: " + failure.getMessage());
            parseFailures.add(failure);
        });
        return published(MeasurementIngestor.withParseFailures(ingestor.ingest(records), parseFailures));
    }

    public IngestReport loadSample(SampleDataset dataset) {
        IngestReport report = ingestor.ingestNormalized(dataset.measurements());
        LOGGER.info("Loaded sample dataset " + dataset.name() + ": " + report.acceptedCount() + " measurements");
        return published(report);
    }

    public QueryResult query(Location location, Set<Pollutant> pollutants, TimeWindow window, int horizonSteps) {
        return query(new QueryRequest(location, pollutants, window, horizonSteps));
    }

    public QueryResult query(QueryRequest request) {
        Instant started = clock.instant();
        List<PollutantReport> reports = new ArrayList<>();
        List<Category> categories = new ArrayList<>();
        List<AlertEvent> alerts = new ArrayList<>();
        List<QueryIssue> issues = new ArrayList<>();

        for (Pollutant pollutant : request.pollutants()) {
            JointSeries joint = cache.getOrCompute(
                    new CacheKey(request.location(), pollutant, request.window()),
                    () -> align(request.location(), pollutant, request.window())
            );
            Optional<JointSample> latest = joint.latestPresent();

            ForecastResult forecast = null;
            try {
                forecast = forecaster.forecast(joint, request.horizonSteps());
            } catch (ForecastException e) {
                issues.add(QueryIssue.of(pollutant, e));
            }

            Category current;
            List<ForecastedCategory> forecastCategories;
            try {
                if (!classifier.supports(pollutant)) {
                    throw new ClassificationException(pollutant);
                }
                current = latest.map(sample -> classifier.classify(pollutant, sample.value())).orElse(null);
                forecastCategories = forecastCategories(pollutant, forecast);
            } catch (ClassificationException e) {
                issues.add(QueryIssue.of(pollutant, e));
                reports.add(new PollutantReport(pollutant, joint, null, null, null, forecast));
                continue;
            }

            Instant currentAt = latest.map(JointSample::bucketStart).orElse(null);
            AlertKey key = new AlertKey(request.location(), pollutant);
            AlertEvaluation evaluation = alertStates.update(key,
                    previous -> alertEvaluator.evaluate(key, current, currentAt, forecastCategories, previous));
            alerts.addAll(evaluation.events());
            if (current != null) {
                categories.add(current);
            }
            reports.add(new PollutantReport(pollutant, joint, current, latest.map(JointSample::value).orElse(null), currentAt, forecast));
        }

        Category overall = Category.worst(categories).orElse(null);
        QueryResult result = new QueryResult(request.location(), request.window(), reports, overall, alerts, issues);
        Instant finished = clock.instant();
        for (AlertEvent alert : alerts) {
            eventBus.publish(new AqiAlertRaised(finished, alert));
        }
        eventBus.publish(new QueryCompleted(
                finished,
                request.location(),
                overall,
                alerts.size(),
                issues.stream().map(QueryIssue::code).toList(),
                Duration.between(started, finished).toMillis()
        ));
        LOGGER.fine(() -> "Query at " + request.location() + " -> " + overall + ", " + alerts.size() + " alerts, " + issues.size() + " issues");
        return result;
    }

    private JointSeries align(Location location, Pollutant pollutant, TimeWindow window) {
        List<Measurement> pool = store.find(pollutant, window);
        TimeSeries ground = selector.groundSeries(location, pollutant, window, pool);
        TimeSeries satellite = selector.satelliteSeries(location, pollutant, window, pool);
        return aligner.align(location, pollutant, window, ground, satellite);
    }

    private List<ForecastedCategory> forecastCategories(Pollutant pollutant, ForecastResult forecast) {
        if (forecast == null) {
            return List.of();
        }
        List<ForecastedCategory> categories = new ArrayList<>(forecast.points().size());
        for (ForecastPoint point : forecast.points()) {
            categories.add(new ForecastedCategory(point.timestamp(), classifier.classify(pollutant, point.estimate())));
        }
        return categories;
    }

    private IngestReport published(IngestReport report) {
        if (report.acceptedCount() > 0) {
            cache.invalidateAll();
        }
        eventBus.publish(new MeasurementsIngested(clock.instant(), report.acceptedCount(), report.rejected(), report.rejectionsByReason()));
        return report;
    }
}
