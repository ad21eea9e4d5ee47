package com.example.potholereporter.service.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes images below a local upload directory that is served under
 * {@value #PUBLIC_PREFIX}.
 */
public class LocalImageStorage implements ImageStorage {

    private static final Logger log = LoggerFactory.getLogger(LocalImageStorage.class);

    public static final String PUBLIC_PREFIX = "/uploads/";

    private final Path uploadDir;

    public LocalImageStorage(Path uploadDir) {
        this.uploadDir = Objects.requireNonNull(uploadDir, "uploadDir").toAbsolutePath().normalize();
    }

    @Override
    public String store(byte[] content, String key, String contentType) {
        Path target = resolve(key);
        try {
            Files.createDirectories(uploadDir);
            Files.write(target, content);
        } catch (IOException ex) {
            log.error("Failed to write image {} to {}", key, uploadDir, ex);
            throw new IllegalStateException("Failed to store image " + key, ex);
        }
        log.debug("Stored {} bytes at {}", content.length, target);
        return PUBLIC_PREFIX + key;
    }

    public Path uploadDir() {
        return uploadDir;
    }

    private Path resolve(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Storage key must not be blank");
        }
        Path target = uploadDir.resolve(key).normalize();
        if (!target.getParent().equals(uploadDir)) {
            throw new IllegalArgumentException("Storage key must be a plain file name: " + key);
        }
        return target;
    }
}
