package com.example.potholereporter.model.report;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Main stage of a report's repair workflow.
 */
public enum ReportStatus {
    PENDING("Pending"),
    REPORTED("Reported"),
    INSPECTED("Inspected"),
    IN_PROGRESS("In Progress"),
    RESOLVED("Resolved");

    private final String label;

    ReportStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Accepts the display label ("In Progress") as well as the constant name
     * ("IN_PROGRESS", "in_progress").
     */
    @JsonCreator
    public static ReportStatus fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Status must not be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        for (ReportStatus status : values()) {
            if (status.name().equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown report status: " + value);
    }
}
