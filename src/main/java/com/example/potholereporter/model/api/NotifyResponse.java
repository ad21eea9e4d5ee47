package com.example.potholereporter.model.api;

import com.example.potholereporter.model.notification.DeliveryStatus;
import com.example.potholereporter.model.report.ReportStatus;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Outcome of notifying the road authority about a report")
public record NotifyResponse(
        @Schema(example = "Authorities notified") String message,
        String notificationId,
        @Schema(example = "mocked") DeliveryStatus deliveryStatus,
        @Schema(example = "Reported") ReportStatus newStatus) {
}
