package com.example.potholereporter.model.api;

import com.example.potholereporter.model.MeasuredDetection;
import com.example.potholereporter.model.report.Report;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Stored report together with the individual detections behind its estimate")
public record ReportSubmissionResponse(
        Report report,
        List<MeasuredDetection> detections) {
}
