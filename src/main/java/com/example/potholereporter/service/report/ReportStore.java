package com.example.potholereporter.service.report;

import com.example.potholereporter.model.report.Report;
import com.example.potholereporter.service.lifecycle.Transition;

import java.util.List;
import java.util.Optional;

public interface ReportStore {

    Report insert(Report report);

    Optional<Report> findById(String id);

    /**
     * @return matching reports, newest first, at most {@code limit}
     */
    List<Report> find(ReportFilter filter, int limit);

    /**
     * Appends the transition's audit entry and applies its status changes in a
     * single atomic update. Concurrent calls for the same report never lose an
     * entry.
     *
     * @return the updated report, or empty when no report has this id
     */
    Optional<Report> applyTransition(String id, Transition transition);
}
