package com.example.potholereporter.model.api;

import com.example.potholereporter.model.user.Role;
import com.example.potholereporter.model.user.UserAccount;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(description = "Public view of a user account")
public record UserSummary(
        String id,
        String name,
        String email,
        @Schema(example = "citizen") Role role,
        Instant createdAt) {

    public static UserSummary of(UserAccount account) {
        return new UserSummary(account.id(), account.name(), account.email(), account.role(), account.createdAt());
    }
}
