package com.example.potholereporter.model.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ReportActionRequest(
        @Schema(description = "Lifecycle action name", example = "schedule-repair", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        @Size(max = 64)
        String action,
        @Schema(description = "Optional note stored in the audit trail", example = "Crew B, Monday morning")
        @Size(max = 2000)
        String notes) {
}
