package com.example.potholereporter.model.report;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Auxiliary inspection-drone tag shown next to the main status.
 */
public enum DroneStatus {
    UNASSIGNED,
    IN_PROGRESS,
    COMPLETED;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
