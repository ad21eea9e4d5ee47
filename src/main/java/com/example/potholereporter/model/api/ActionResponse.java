package com.example.potholereporter.model.api;

import com.example.potholereporter.model.report.Report;
import com.example.potholereporter.model.report.ReportStatus;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Outcome of a lifecycle action")
public record ActionResponse(
        @Schema(example = "Action recorded") String message,
        @Schema(example = "In Progress") ReportStatus newStatus,
        Report report) {
}
