package com.example.potholereporter.service.report;

import java.util.Objects;

/**
 * Raw, unvalidated form fields of a report upload.
 *
 * @param coordinates    JSON object with {@code lat}/{@code lng} (or {@code latitude}/{@code longitude})
 * @param distanceFactor optional camera distance correction, defaults to 1.0
 */
public record ReportSubmission(
        String fileName,
        String contentType,
        byte[] content,
        String location,
        String coordinates,
        Double distanceFactor) {

    public ReportSubmission {
        Objects.requireNonNull(content, "content");
    }
}
