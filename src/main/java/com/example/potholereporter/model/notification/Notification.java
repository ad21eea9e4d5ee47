package com.example.potholereporter.model.notification;

import io.swagger.v3.oas.annotations.media.Schema;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Objects;

@Document(collection = "notifications")
@Schema(description = "Record of one SMS delivery attempt")
public record Notification(
        @Id String id,
        @Schema(description = "Recipient phone number", example = "+918010303436") String phoneNumber,
        @Schema(description = "Message body") String message,
        @Schema(description = "Delivery outcome", example = "mocked") DeliveryStatus status,
        @Schema(description = "Provider message reference when sent") String providerRef,
        @Schema(description = "Provider error when delivery failed") String error,
        @Schema(description = "Report the notification refers to") String reportId,
        @Indexed Instant createdAt) {

    public static final String FIELD_CREATED_AT = "createdAt";

    public Notification {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
    }
}
