package com.example.potholereporter.service.detection;

import com.example.potholereporter.model.Detection;

import java.util.List;

/**
 * Detector that never finds anything. Used when no inference provider is
 * configured so uploads still produce a valid zero-detection report.
 */
public class NoOpPotholeDetector implements PotholeDetector {

    @Override
    public List<Detection> detect(UploadedImage image) {
        return List.of();
    }
}
