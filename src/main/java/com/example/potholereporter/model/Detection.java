package com.example.potholereporter.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Objects;

@Schema(description = "Single pothole candidate returned by the inference provider")
public record Detection(
        @Schema(description = "Pixel bounding box of the pothole") BoundingBox box,
        @Schema(description = "Model confidence between 0 and 1", example = "0.87") double confidence) {

    public Detection {
        Objects.requireNonNull(box, "box");
        if (!(confidence >= 0d && confidence <= 1d)) {
            throw new IllegalArgumentException("Detection confidence must be between 0 and 1");
        }
    }
}
