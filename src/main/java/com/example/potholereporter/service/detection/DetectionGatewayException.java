package com.example.potholereporter.service.detection;

public class DetectionGatewayException extends RuntimeException {

    public DetectionGatewayException(String message) {
        super(message);
    }

    public DetectionGatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
