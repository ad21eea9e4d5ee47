package com.example.potholereporter.service.detection;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Uploaded photo in both encoded and decoded form. Remote providers need the
 * original bytes while local models and the estimator work on pixels.
 */
public record UploadedImage(String fileName, String contentType, byte[] content, BufferedImage pixels) {

    public UploadedImage {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(pixels, "pixels");
    }

    public int width() {
        return pixels.getWidth();
    }

    public int height() {
        return pixels.getHeight();
    }
}
