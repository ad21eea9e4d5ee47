package com.example.potholereporter.config;

import com.example.potholereporter.service.notification.MockSmsSender;
import com.example.potholereporter.service.notification.NotificationService;
import com.example.potholereporter.service.notification.NotificationStore;
import com.example.potholereporter.service.notification.SmsSender;
import com.example.potholereporter.service.notification.TwilioSmsSender;
import com.twilio.http.TwilioRestClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class NotificationConfiguration {

    private static final Logger log = LoggerFactory.getLogger(NotificationConfiguration.class);

    @Bean
    public SmsSender smsSender(PotholeProperties properties) {
        PotholeProperties.SmsProperties sms = properties.sms();
        if (sms.provider() == PotholeProperties.SmsProvider.TWILIO) {
            if (isBlank(sms.accountSid()) || isBlank(sms.authToken()) || isBlank(sms.fromNumber())) {
                throw new IllegalStateException("Twilio SMS requires account-sid, auth-token and from-number");
            }
            log.info("Sending SMS through Twilio from {}", sms.fromNumber());
            TwilioRestClient client = new TwilioRestClient.Builder(sms.accountSid(), sms.authToken()).build();
            return new TwilioSmsSender(client, sms.fromNumber());
        }
        log.info("SMS delivery is mocked; messages are only logged");
        return new MockSmsSender();
    }

    @Bean
    public NotificationService notificationService(SmsSender smsSender, NotificationStore notificationStore, Clock clock) {
        return new NotificationService(smsSender, notificationStore, clock);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
