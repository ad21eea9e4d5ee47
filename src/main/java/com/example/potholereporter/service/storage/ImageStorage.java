package com.example.potholereporter.service.storage;

/**
 * Stores uploaded and annotated images and returns the URL clients use to
 * fetch them.
 */
public interface ImageStorage {

    /**
     * @return an absolute URL for remote storage or a path relative to this
     * service for local storage
     */
    String store(byte[] content, String key, String contentType);
}
