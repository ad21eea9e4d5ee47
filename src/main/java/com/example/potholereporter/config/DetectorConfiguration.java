package com.example.potholereporter.config;

import com.example.potholereporter.service.detection.NoOpPotholeDetector;
import com.example.potholereporter.service.detection.OnnxPotholeDetector;
import com.example.potholereporter.service.detection.PotholeDetector;
import com.example.potholereporter.service.detection.RoboflowPotholeDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Selects the {@link PotholeDetector} from {@code pothole.detection.provider}.
 */
@Configuration
public class DetectorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DetectorConfiguration.class);

    @Bean
    public PotholeDetector potholeDetector(PotholeProperties properties, RestTemplateBuilder restTemplateBuilder) {
        PotholeProperties.DetectionProperties detection = properties.detection();
        switch (detection.provider()) {
            case ROBOFLOW -> {
                log.info("Using hosted pothole detection model {} at {}", detection.modelId(), detection.apiUrl());
                RestTemplate restTemplate = restTemplateBuilder
                        .setConnectTimeout(detection.connectTimeout())
                        .setReadTimeout(detection.readTimeout())
                        .build();
                return new RoboflowPotholeDetector(restTemplate, detection.apiUrl(), detection.apiKey(), detection.modelId());
            }
            case ONNX -> {
                log.info("Using local ONNX pothole model at {}", detection.modelPath());
                return new OnnxPotholeDetector(detection.modelPath(), detection.inputSize(),
                        detection.confThreshold(), detection.nmsThreshold());
            }
            default -> {
                log.warn("Pothole detection is disabled; every report will have zero detections");
                return new NoOpPotholeDetector();
            }
        }
    }
}
