package com.example.potholereporter.model.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record LoginRequest(
        @Schema(example = "asha@example.com", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        @Email
        String email,
        @Schema(requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        String password) {
}
