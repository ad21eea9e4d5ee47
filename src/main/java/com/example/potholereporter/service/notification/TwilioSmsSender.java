package com.example.potholereporter.service.notification;

import com.twilio.exception.TwilioException;
import com.twilio.http.TwilioRestClient;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

public class TwilioSmsSender implements SmsSender {

    private static final Logger log = LoggerFactory.getLogger(TwilioSmsSender.class);

    private final TwilioRestClient client;
    private final String fromNumber;

    public TwilioSmsSender(TwilioRestClient client, String fromNumber) {
        this.client = Objects.requireNonNull(client, "client");
        if (fromNumber == null || fromNumber.isBlank()) {
            throw new IllegalStateException("Twilio sender phone number must be configured");
        }
        this.fromNumber = fromNumber;
    }

    @Override
    public SmsResult send(String phoneNumber, String message) {
        try {
            Message sent = Message.creator(new PhoneNumber(phoneNumber), new PhoneNumber(fromNumber), message)
                    .create(client);
            log.info("SMS sent to {} (sid {})", phoneNumber, sent.getSid());
            return SmsResult.sent(sent.getSid());
        } catch (TwilioException ex) {
            log.error("Twilio send to {} failed", phoneNumber, ex);
            return SmsResult.failed(ex.getMessage());
        }
    }
}
