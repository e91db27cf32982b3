package com.airsentinel.service.query;

import com.airsentinel.core.model.AlertEvent;
import com.airsentinel.core.model.Category;
import com.airsentinel.core.model.Location;
import com.airsentinel.core.model.Pollutant;
import com.airsentinel.core.model.TimeWindow;

import java.util.List;
import java.util.Optional;

public record QueryResult(
        Location location,
        TimeWindow window,
        List<PollutantReport> reports,
        Category overallCategory,
        List<AlertEvent> alerts,
        List<QueryIssue> issues
) {
    public QueryResult {
        reports = List.copyOf(reports);
        alerts = List.copyOf(alerts);
        issues = List.copyOf(issues);
    }

    public Optional<PollutantReport> report(Pollutant pollutant) {
        return reports.stream().filter(report -> report.pollutant() == pollutant).findFirst();
    }
}
