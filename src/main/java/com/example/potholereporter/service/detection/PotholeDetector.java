package com.example.potholereporter.service.detection;

import com.example.potholereporter.model.Detection;

import java.util.List;

/**
 * Finds pothole regions inside a street photo. Implementations may call a
 * hosted inference API or run a local model; they are selected through
 * Spring configuration.
 */
public interface PotholeDetector {

    /**
     * @param image decoded upload
     * @return detected potholes, possibly empty
     * @throws DetectionGatewayException when the provider is unavailable,
     *                                   times out or returns malformed output
     */
    List<Detection> detect(UploadedImage image);
}
