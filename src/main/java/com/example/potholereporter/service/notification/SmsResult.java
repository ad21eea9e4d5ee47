package com.example.potholereporter.service.notification;

import com.example.potholereporter.model.notification.DeliveryStatus;

import java.util.Objects;

public record SmsResult(DeliveryStatus status, String providerRef, String error) {

    public SmsResult {
        Objects.requireNonNull(status, "status");
    }

    public static SmsResult sent(String providerRef) {
        return new SmsResult(DeliveryStatus.SENT, providerRef, null);
    }

    public static SmsResult failed(String error) {
        return new SmsResult(DeliveryStatus.FAILED, null, error);
    }

    public static SmsResult mocked() {
        return new SmsResult(DeliveryStatus.MOCKED, null, null);
    }
}
