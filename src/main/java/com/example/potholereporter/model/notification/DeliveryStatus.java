package com.example.potholereporter.model.notification;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DeliveryStatus {
    SENT,
    FAILED,
    MOCKED;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
