package com.example.potholereporter.model.report;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "WGS84 coordinates of the reported pothole")
public record GeoPoint(
        @Schema(description = "Latitude in degrees", example = "19.0760") double latitude,
        @Schema(description = "Longitude in degrees", example = "72.8777") double longitude) {

    public GeoPoint {
        if (!Double.isFinite(latitude) || latitude < -90d || latitude > 90d) {
            throw new IllegalArgumentException("Latitude must be between -90 and 90");
        }
        if (!Double.isFinite(longitude) || longitude < -180d || longitude > 180d) {
            throw new IllegalArgumentException("Longitude must be between -180 and 180");
        }
    }
}
