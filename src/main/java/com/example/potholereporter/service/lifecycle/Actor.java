package com.example.potholereporter.service.lifecycle;

import com.example.potholereporter.model.user.Role;

/**
 * Identity recorded in the audit trail. Both fields are {@code null} for
 * anonymous actions.
 */
public record Actor(String id, Role role) {

    private static final Actor ANONYMOUS = new Actor(null, null);

    public static Actor anonymous() {
        return ANONYMOUS;
    }

    public String roleLabel() {
        return role != null ? role.label() : null;
    }
}
