package com.example.potholereporter.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Axis-aligned bounding box of a detected pothole inside a source image.
 * Coordinates follow the image pixel grid with the origin located in the
 * top-left corner.
 */
@Schema(description = "Axis-aligned rectangle describing a detected pothole region")
public record BoundingBox(
        @Schema(description = "X coordinate of the top-left corner", example = "412.5") double x,
        @Schema(description = "Y coordinate of the top-left corner", example = "300.0") double y,
        @Schema(description = "Bounding box width in pixels", example = "100") double width,
        @Schema(description = "Bounding box height in pixels", example = "50") double height) {

    public BoundingBox {
        if (!Double.isFinite(width) || width < 0) {
            throw new IllegalArgumentException("Bounding box width must be a non-negative number");
        }
        if (!Double.isFinite(height) || height < 0) {
            throw new IllegalArgumentException("Bounding box height must be a non-negative number");
        }
    }

    public static BoundingBox fromCenter(double centerX, double centerY, double width, double height) {
        return new BoundingBox(centerX - width / 2d, centerY - height / 2d, width, height);
    }
}
