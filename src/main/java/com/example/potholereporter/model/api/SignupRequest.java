package com.example.potholereporter.model.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SignupRequest(
        @Schema(description = "Display name", example = "Asha Rao", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        String name,
        @Schema(description = "Unique e-mail address", example = "asha@example.com", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        @Email
        String email,
        @Schema(description = "Plain-text password, hashed before storage", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank
        @Size(max = 72)
        String password,
        @Schema(description = "Either 'citizen' (default) or 'authority'", example = "citizen")
        String role) {
}
