package com.example.potholereporter.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Per-image summary of all pothole detections")
public record AggregateResult(
        @Schema(description = "Number of detected potholes", example = "2") int count,
        @Schema(description = "Sum of the detection areas in square meters", example = "0.18") double totalAreaSquareMeters,
        @Schema(description = "Mean detection confidence, 0 when nothing was detected", example = "0.81") double meanConfidence,
        @Schema(description = "Individual detections with their areas") List<MeasuredDetection> detections) {

    public AggregateResult {
        detections = detections == null ? List.of() : List.copyOf(detections);
    }

    public static AggregateResult empty() {
        return new AggregateResult(0, 0d, 0d, List.of());
    }
}
