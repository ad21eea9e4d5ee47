package com.example.potholereporter.model.report;

import com.example.potholereporter.model.Severity;
import io.swagger.v3.oas.annotations.media.Schema;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Persisted pothole report. Instances are immutable; lifecycle changes produce
 * a new instance through {@link #withAction}.
 */
@Document(collection = "reports")
@CompoundIndex(name = "status_severity", def = "{'status': 1, 'severity': 1}")
@Schema(description = "Pothole report with its repair estimate and audit trail")
public record Report(
        @Id String id,
        @Indexed String ownerId,
        String imageUrl,
        String annotatedImageUrl,
        String location,
        GeoPoint coordinates,
        int detectionCount,
        double totalAreaSquareMeters,
        double confidence,
        Severity severity,
        String material,
        int bagsRequired,
        long estimatedCost,
        ReportStatus status,
        DroneStatus droneStatus,
        List<AuditEntry> audit,
        @Indexed Instant createdAt,
        Instant updatedAt) {

    public static final String FIELD_ID = "id";
    public static final String FIELD_OWNER = "ownerId";
    public static final String FIELD_STATUS = "status";
    public static final String FIELD_DRONE_STATUS = "droneStatus";
    public static final String FIELD_SEVERITY = "severity";
    public static final String FIELD_AUDIT = "audit";
    public static final String FIELD_CREATED_AT = "createdAt";
    public static final String FIELD_UPDATED_AT = "updatedAt";

    public Report {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
        audit = audit == null ? List.of() : List.copyOf(audit);
    }

    /**
     * Returns a copy with {@code entry} appended to the audit trail and the
     * status fields replaced where the new values are non-null.
     */
    public Report withAction(AuditEntry entry, ReportStatus newStatus, DroneStatus newDroneStatus, Instant updatedAt) {
        Objects.requireNonNull(entry, "entry");
        List<AuditEntry> appended = new ArrayList<>(audit.size() + 1);
        appended.addAll(audit);
        appended.add(entry);
        return new Report(id, ownerId, imageUrl, annotatedImageUrl, location, coordinates,
                detectionCount, totalAreaSquareMeters, confidence, severity, material, bagsRequired, estimatedCost,
                newStatus != null ? newStatus : status,
                newDroneStatus != null ? newDroneStatus : droneStatus,
                appended, createdAt, updatedAt);
    }
}
