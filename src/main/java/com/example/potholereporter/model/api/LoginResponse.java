package com.example.potholereporter.model.api;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(description = "Bearer credential issued on successful login")
public record LoginResponse(
        @Schema(description = "Signed JWT to send as 'Authorization: Bearer <token>'") String accessToken,
        @Schema(example = "Bearer") String tokenType,
        @Schema(description = "Token expiry") Instant expiresAt,
        UserSummary user) {
}
