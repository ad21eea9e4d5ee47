package com.example.potholereporter.service.notification;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs messages instead of sending them.
 */
public class MockSmsSender implements SmsSender {

    private static final Logger log = LoggerFactory.getLogger(MockSmsSender.class);

    @Override
    public SmsResult send(String phoneNumber, String message) {
        log.info("[MOCK SMS] -> {}: {}", phoneNumber, message);
        return SmsResult.mocked();
    }
}
