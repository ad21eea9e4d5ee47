package com.example.potholereporter.service.lifecycle;

import com.example.potholereporter.model.report.AuditEntry;
import com.example.potholereporter.model.report.DroneStatus;
import com.example.potholereporter.model.report.ReportStatus;

import java.util.Objects;

/**
 * Result of resolving an action: the audit entry to append and the fields to
 * overwrite. {@code null} status fields are left untouched by the store.
 */
public record Transition(AuditEntry entry, ReportStatus targetStatus, DroneStatus targetDroneStatus) {

    public Transition {
        Objects.requireNonNull(entry, "entry");
    }

    public boolean changesStatus() {
        return targetStatus != null;
    }
}
