package com.example.potholereporter.service.detection;

import com.example.potholereporter.model.BoundingBox;
import com.example.potholereporter.model.Detection;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Calls the Roboflow hosted inference API. Predictions are returned as box
 * centres, which are converted to top-left based {@link BoundingBox}es.
 */
public class RoboflowPotholeDetector implements PotholeDetector {

    private static final Logger log = LoggerFactory.getLogger(RoboflowPotholeDetector.class);

    private final RestTemplate restTemplate;
    private final String apiUrl;
    private final String apiKey;
    private final String modelId;

    public RoboflowPotholeDetector(RestTemplate restTemplate, String apiUrl, String apiKey, String modelId) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        if (!StringUtils.hasText(apiUrl) || !StringUtils.hasText(modelId)) {
            throw new IllegalStateException("Roboflow API URL and model id must be configured");
        }
        this.apiUrl = apiUrl;
        this.apiKey = apiKey;
        this.modelId = modelId;
    }

    @Override
    public List<Detection> detect(UploadedImage image) {
        Objects.requireNonNull(image, "UploadedImage must not be null");
        URI uri = UriComponentsBuilder.fromHttpUrl(apiUrl)
                .pathSegment(modelId.split("/"))
                .queryParamIfPresent("api_key", Optional.ofNullable(apiKey).filter(StringUtils::hasText))
                .build()
                .toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        HttpEntity<String> request = new HttpEntity<>(Base64.getEncoder().encodeToString(image.content()), headers);

        long start = System.nanoTime();
        InferenceResponse response;
        try {
            response = restTemplate.postForObject(uri, request, InferenceResponse.class);
        } catch (RestClientException ex) {
            log.error("Roboflow inference failed for model {}", modelId, ex);
            throw new DetectionGatewayException("Detection provider request failed: " + ex.getMessage(), ex);
        }
        long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

        if (response == null) {
            throw new DetectionGatewayException("Detection provider returned an empty body");
        }
        List<Detection> detections = toDetections(response);
        log.debug("Roboflow model {} returned {} detections in {} ms", modelId, detections.size(), elapsedMs);
        return detections;
    }

    private List<Detection> toDetections(InferenceResponse response) {
        if (response.predictions() == null) {
            return List.of();
        }
        List<Detection> detections = new ArrayList<>(response.predictions().size());
        for (Prediction prediction : response.predictions()) {
            if (prediction == null || prediction.width() == null || prediction.height() == null
                    || prediction.x() == null || prediction.y() == null || prediction.confidence() == null) {
                throw new DetectionGatewayException("Detection provider returned an incomplete prediction");
            }
            try {
                BoundingBox box = BoundingBox.fromCenter(prediction.x(), prediction.y(),
                        prediction.width(), prediction.height());
                detections.add(new Detection(box, prediction.confidence()));
            } catch (IllegalArgumentException ex) {
                throw new DetectionGatewayException("Detection provider returned a malformed prediction", ex);
            }
        }
        return detections;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record InferenceResponse(List<Prediction> predictions) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Prediction(Double x, Double y, Double width, Double height, Double confidence) {
    }
}
