package com.example.potholereporter.service.report;

import com.example.potholereporter.model.Severity;
import com.example.potholereporter.model.report.ReportStatus;

/**
 * Equality filter over reports; {@code null} fields match everything.
 */
public record ReportFilter(ReportStatus status, Severity severity, String ownerId) {

    public static ReportFilter all() {
        return new ReportFilter(null, null, null);
    }

    public static ReportFilter ownedBy(String ownerId) {
        return new ReportFilter(null, null, ownerId);
    }

    public ReportFilter withOwner(String owner) {
        return new ReportFilter(status, severity, owner);
    }
}
