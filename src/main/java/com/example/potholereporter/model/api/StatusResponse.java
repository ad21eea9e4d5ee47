package com.example.potholereporter.model.api;

public record StatusResponse(String message, String status) {
}
