package com.example.potholereporter.model.user;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Objects;

@Document(collection = "users")
public record UserAccount(
        @Id String id,
        String name,
        @Indexed(unique = true) String email,
        String passwordHash,
        Role role,
        Instant createdAt) {

    public static final String FIELD_EMAIL = "email";

    public UserAccount {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(role, "role");
    }
}
