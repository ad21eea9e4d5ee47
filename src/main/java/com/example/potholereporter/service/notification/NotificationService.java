package com.example.potholereporter.service.notification;

import com.example.potholereporter.model.notification.Notification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Sends SMS messages and records every attempt, successful or not.
 */
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    static final int LIST_LIMIT = 100;

    private final SmsSender smsSender;
    private final NotificationStore store;
    private final Clock clock;

    public NotificationService(SmsSender smsSender, NotificationStore store, Clock clock) {
        this.smsSender = smsSender;
        this.store = store;
        this.clock = clock;
    }

    public Notification send(String phoneNumber, String message, String reportId) {
        SmsResult result;
        try {
            result = smsSender.send(phoneNumber, message);
        } catch (RuntimeException ex) {
            log.error("SMS provider threw while sending to {}", phoneNumber, ex);
            result = SmsResult.failed(ex.getMessage());
        }
        Notification notification = new Notification(
                UUID.randomUUID().toString(),
                phoneNumber,
                message,
                result.status(),
                result.providerRef(),
                result.error(),
                reportId,
                Instant.now(clock));
        log.info("Recorded notification {} for report {} with status {}", notification.id(), reportId, result.status());
        return store.save(notification);
    }

    public List<Notification> latest() {
        return store.findLatest(LIST_LIMIT);
    }
}
