package com.example.potholereporter.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Detection together with its estimated real-world area")
public record MeasuredDetection(
        @Schema(description = "Pixel bounding box of the pothole") BoundingBox box,
        @Schema(description = "Model confidence between 0 and 1", example = "0.87") double confidence,
        @Schema(description = "Estimated surface area in square meters", example = "0.06125") double areaSquareMeters) {
}
