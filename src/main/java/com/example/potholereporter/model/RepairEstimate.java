package com.example.potholereporter.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Repair material and cost derived from severity and area")
public record RepairEstimate(
        @Schema(description = "Recommended repair material", example = "Cold Patch Asphalt") String material,
        @Schema(description = "Number of material bags required", example = "2") int bagsRequired,
        @Schema(description = "Estimated cost in INR", example = "700") long estimatedCost) {
}
