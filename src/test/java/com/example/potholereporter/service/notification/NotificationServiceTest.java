package com.example.potholereporter.service.notification;

import com.example.potholereporter.model.notification.DeliveryStatus;
import com.example.potholereporter.model.notification.Notification;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class NotificationServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final InMemoryNotificationStore store = new InMemoryNotificationStore();

    @Test
    void mockSenderRecordsMockedNotification() {
        NotificationService service = new NotificationService(new MockSmsSender(), store, Clock.fixed(NOW, ZoneOffset.UTC));

        Notification notification = service.send("+911234567890", "hello", "r-1");

        assertThat(notification.status()).isEqualTo(DeliveryStatus.MOCKED);
        assertThat(notification.reportId()).isEqualTo("r-1");
        assertThat(notification.createdAt()).isEqualTo(NOW);
        assertThat(service.latest()).containsExactly(notification);
    }

    @Test
    void providerErrorIsRecordedAsFailedInsteadOfThrown() {
        SmsSender sender = mock(SmsSender.class);
        when(sender.send("+911234567890", "hello")).thenThrow(new IllegalStateException("provider offline"));
        NotificationService service = new NotificationService(sender, store, Clock.fixed(NOW, ZoneOffset.UTC));

        Notification notification = service.send("+911234567890", "hello", null);

        assertThat(notification.status()).isEqualTo(DeliveryStatus.FAILED);
        assertThat(notification.error()).isEqualTo("provider offline");
        assertThat(store.findLatest(10)).containsExactly(notification);
    }

    @Test
    void failedResultIsPersistedWithItsError() {
        SmsSender sender = mock(SmsSender.class);
        when(sender.send("+911", "m")).thenReturn(SmsResult.failed("invalid number"));
        NotificationService service = new NotificationService(sender, store, Clock.fixed(NOW, ZoneOffset.UTC));

        Notification notification = service.send("+911", "m", "r-2");

        assertThat(notification.status()).isEqualTo(DeliveryStatus.FAILED);
        assertThat(notification.error()).isEqualTo("invalid number");
        assertThat(notification.providerRef()).isNull();
    }

    @Test
    void latestIsNewestFirstAndCapped() {
        for (int i = 0; i < NotificationService.LIST_LIMIT + 5; i++) {
            Clock clock = Clock.fixed(NOW.plusSeconds(i), ZoneId.of("UTC"));
            new NotificationService(new MockSmsSender(), store, clock).send("+91" + i, "m" + i, null);
        }
        NotificationService service = new NotificationService(new MockSmsSender(), store, Clock.systemUTC());

        List<Notification> latest = service.latest();

        assertThat(latest).hasSize(NotificationService.LIST_LIMIT);
        assertThat(latest.get(0).message()).isEqualTo("m" + (NotificationService.LIST_LIMIT + 4));
        assertThat(latest).isSortedAccordingTo((a, b) -> b.createdAt().compareTo(a.createdAt()));
    }
}
