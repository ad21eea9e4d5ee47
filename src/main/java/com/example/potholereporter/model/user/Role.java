package com.example.potholereporter.model.user;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Role {
    CITIZEN,
    AUTHORITY;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Spring Security authority name, e.g. {@code ROLE_AUTHORITY}.
     */
    public String authority() {
        return "ROLE_" + name();
    }

    @JsonCreator
    public static Role fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return CITIZEN;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.name().equals(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Role must be either 'citizen' or 'authority'");
    }
}
