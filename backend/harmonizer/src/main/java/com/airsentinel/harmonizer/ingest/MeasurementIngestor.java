package com.airsentinel.harmonizer.ingest;

import com.airsentinel.core.error.SchemaException;
import com.airsentinel.core.model.Measurement;
import com.airsentinel.harmonizer.api.MeasurementStore;
import com.airsentinel.harmonizer.normalize.Normalizer;
import com.airsentinel.harmonizer.normalize.RawRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Logger;

public final class MeasurementIngestor {
    private static final Logger LOGGER = Logger.getLogger(MeasurementIngestor.class.getName());

    private final Normalizer normalizer;
    private final MeasurementStore store;

    public MeasurementIngestor(Normalizer normalizer, MeasurementStore store) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.store = Objects.requireNonNull(store, "store is required");
    }

    public IngestReport ingest(Collection<? extends RawRecord> records) {
        return run(records, normalizer::normalize);
    }

    public IngestReport ingestNormalized(Collection<Measurement> measurements) {
        return run(measurements, normalizer::validate);
    }

    public static IngestReport withParseFailures(IngestReport report, Collection<SchemaException> failures) {
        if (failures.isEmpty()) {
            return report;
        }
        Map<String, Integer> reasons = new HashMap<>(report.rejectionsByReason());
        for (SchemaException failure : failures) {
            reasons.merge(failure.code(), 1, Integer::sum);
        }
        return IngestReport.of(report.accepted(), reasons);
    }

    private <T> IngestReport run(Collection<? extends T> inputs, Function<T, Measurement> step) {
        List<Measurement> accepted = new ArrayList<>(inputs.size());
        Map<String, Integer> reasons = new HashMap<>();
        for (T input : inputs) {
            try {
                accepted.add(step.apply(input));
            } catch (SchemaException e) {
                reasons.merge(e.code(), 1, Integer::sum);
                LOGGER.warning("Dropped record: " + e.getMessage());
            }
        }
        store.addAll(accepted);
        IngestReport report = IngestReport.of(accepted, reasons);
        LOGGER.fine(() -> "Ingested " + report.acceptedCount() + " measurements, rejected " + report.rejected());
        return report;
    }
}
