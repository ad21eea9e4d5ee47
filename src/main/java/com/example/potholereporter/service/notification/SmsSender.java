package com.example.potholereporter.service.notification;

/**
 * Sends a text message through an SMS provider. Implementations report
 * provider failures in the returned {@link SmsResult} instead of throwing.
 */
public interface SmsSender {

    SmsResult send(String phoneNumber, String message);
}
