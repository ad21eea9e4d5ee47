package com.example.potholereporter.service.detection;

/**
 * Image bytes together with the file extension and MIME type they were
 * actually written in.
 */
public record EncodedImage(byte[] content, String extension, String contentType) {
}
