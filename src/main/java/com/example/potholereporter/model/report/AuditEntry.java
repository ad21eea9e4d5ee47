package com.example.potholereporter.model.report;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.Objects;

@Schema(description = "Immutable record of one action taken on a report")
public record AuditEntry(
        @Schema(description = "Action name", example = "schedule-repair") String action,
        @Schema(description = "Identifier of the acting user, if authenticated") String actorId,
        @Schema(description = "Role of the acting user, if authenticated", example = "authority") String actorRole,
        @Schema(description = "Free-text note supplied with the action") String notes,
        @Schema(description = "When the action was recorded") Instant timestamp) {

    public AuditEntry {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
