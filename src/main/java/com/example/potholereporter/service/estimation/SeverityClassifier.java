package com.example.potholereporter.service.estimation;

import com.example.potholereporter.model.Severity;

/**
 * Maps the total pothole area of a report to a severity band. Bands are
 * half-open, so a boundary value belongs to the higher band.
 */
public final class SeverityClassifier {

    static final double MODERATE_FROM_M2 = 0.2;
    static final double SEVERE_FROM_M2 = 0.5;
    static final double CRITICAL_FROM_M2 = 1.0;

    private SeverityClassifier() {
    }

    public static Severity classify(double totalAreaSquareMeters) {
        if (totalAreaSquareMeters < MODERATE_FROM_M2) {
            return Severity.MINOR;
        }
        if (totalAreaSquareMeters < SEVERE_FROM_M2) {
            return Severity.MODERATE;
        }
        if (totalAreaSquareMeters < CRITICAL_FROM_M2) {
            return Severity.SEVERE;
        }
        return Severity.CRITICAL;
    }
}
