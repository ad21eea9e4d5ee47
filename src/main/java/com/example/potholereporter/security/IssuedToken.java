package com.example.potholereporter.security;

import java.time.Instant;

public record IssuedToken(String value, Instant expiresAt) {
}
