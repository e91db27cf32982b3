package com.airsentinel.harmonizer.ingest;

import com.airsentinel.core.model.Measurement;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public record IngestReport(List<Measurement> accepted, int rejected, Map<String, Integer> rejectionsByReason) {
    public IngestReport {
        accepted = List.copyOf(accepted);
        rejectionsByReason = Map.copyOf(rejectionsByReason);
    }

    public static IngestReport of(List<Measurement> accepted, Map<String, Integer> rejectionsByReason) {
        int rejected = rejectionsByReason.values().stream().mapToInt(Integer::intValue).sum();
        return new IngestReport(accepted, rejected, new TreeMap<>(rejectionsByReason));
    }

    public int acceptedCount() {
        return accepted.size();
    }
}
