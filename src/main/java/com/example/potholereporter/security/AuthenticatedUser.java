package com.example.potholereporter.security;

import com.example.potholereporter.model.user.Role;
import com.example.potholereporter.service.lifecycle.Actor;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.List;

/**
 * Principal stored in the security context for requests carrying a valid
 * bearer token.
 */
public record AuthenticatedUser(String id, String email, Role role) {

    public boolean isAuthority() {
        return role == Role.AUTHORITY;
    }

    public Actor toActor() {
        return new Actor(id, role);
    }

    List<SimpleGrantedAuthority> authorities() {
        return List.of(new SimpleGrantedAuthority(role.authority()));
    }
}
