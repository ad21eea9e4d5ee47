package com.example.potholereporter.config;

import java.time.Duration;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "pothole")
public record PotholeProperties(
        @DefaultValue DetectionProperties detection,
        @DefaultValue EstimationProperties estimation,
        @DefaultValue StorageProperties storage,
        @DefaultValue SmsProperties sms,
        @DefaultValue SecurityProperties security,
        @DefaultValue PersistenceProperties persistence,
        @DefaultValue CorsProperties cors) {

    public enum DetectionProvider {
        ROBOFLOW, ONNX, NONE
    }

    public enum StorageMode {
        LOCAL, S3
    }

    public enum SmsProvider {
        MOCK, TWILIO
    }

    public enum PersistenceMode {
        MONGO, MEMORY
    }

    public record DetectionProperties(
            @DefaultValue("roboflow") DetectionProvider provider,
            @DefaultValue("https://serverless.roboflow.com") String apiUrl,
            String apiKey,
            String modelId,
            @DefaultValue("5s") Duration connectTimeout,
            @DefaultValue("30s") Duration readTimeout,
            @DefaultValue("./models/pothole_yolov8n.onnx") String modelPath,
            @DefaultValue("640") int inputSize,
            @DefaultValue("0.25") double confThreshold,
            @DefaultValue("0.45") double nmsThreshold) {
    }

    public record EstimationProperties(
            @DefaultValue("3.5") double laneWidthMeters) {
    }

    public record StorageProperties(
            @DefaultValue("local") StorageMode mode,
            @DefaultValue("./uploads") String uploadDir,
            @DefaultValue("pothole-images-bucket") String bucket,
            @DefaultValue("ap-south-1") String region,
            String endpoint) {
    }

    public record SmsProperties(
            @DefaultValue("mock") SmsProvider provider,
            String accountSid,
            String authToken,
            String fromNumber,
            @DefaultValue("+918010303436") String authorityPhone) {
    }

    public record SecurityProperties(
            String jwtSecret,
            @DefaultValue("pothole-reporter") String issuer,
            @DefaultValue("12h") Duration tokenTtl) {
    }

    public record PersistenceProperties(
            @DefaultValue("mongo") PersistenceMode mode) {
    }

    public record CorsProperties(
            @DefaultValue("*") List<String> allowedOrigins) {
    }
}
