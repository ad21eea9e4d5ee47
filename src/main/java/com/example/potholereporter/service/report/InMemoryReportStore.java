package com.example.potholereporter.service.report;

import com.example.potholereporter.model.report.Report;
import com.example.potholereporter.service.lifecycle.ReportLifecycle;
import com.example.potholereporter.service.lifecycle.Transition;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed store for tests and single-node development. Transitions rely on
 * {@link ConcurrentHashMap#computeIfPresent} being atomic per key.
 */
public class InMemoryReportStore implements ReportStore {

    private final Map<String, Report> reports = new ConcurrentHashMap<>();

    @Override
    public Report insert(Report report) {
        if (reports.putIfAbsent(report.id(), report) != null) {
            throw new IllegalStateException("Report " + report.id() + " already exists");
        }
        return report;
    }

    @Override
    public Optional<Report> findById(String id) {
        return Optional.ofNullable(reports.get(id));
    }

    @Override
    public List<Report> find(ReportFilter filter, int limit) {
        return reports.values().stream()
                .filter(report -> filter.status() == null || filter.status() == report.status())
                .filter(report -> filter.severity() == null || filter.severity() == report.severity())
                .filter(report -> filter.ownerId() == null || filter.ownerId().equals(report.ownerId()))
                .sorted(Comparator.comparing(Report::createdAt).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public Optional<Report> applyTransition(String id, Transition transition) {
        return Optional.ofNullable(reports.computeIfPresent(id, (key, current) -> ReportLifecycle.apply(current, transition)));
    }
}
