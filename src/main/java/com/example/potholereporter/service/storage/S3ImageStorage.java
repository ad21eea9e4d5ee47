package com.example.potholereporter.service.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.util.Objects;

/**
 * Uploads images to an S3 bucket. When the upload fails the image is written
 * to local storage instead so the report can still be created.
 */
public class S3ImageStorage implements ImageStorage {

    private static final Logger log = LoggerFactory.getLogger(S3ImageStorage.class);

    private final S3Client s3Client;
    private final String bucket;
    private final String region;
    private final ImageStorage fallback;

    public S3ImageStorage(S3Client s3Client, String bucket, String region, ImageStorage fallback) {
        this.s3Client = Objects.requireNonNull(s3Client, "s3Client");
        this.bucket = Objects.requireNonNull(bucket, "bucket");
        this.region = Objects.requireNonNull(region, "region");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    @Override
    public String store(byte[] content, String key, String contentType) {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType)
                .build();
        try {
            s3Client.putObject(request, RequestBody.fromBytes(content));
        } catch (SdkException ex) {
            log.warn("S3 upload of {} to bucket {} failed, falling back to local storage", key, bucket, ex);
            return fallback.store(content, key, contentType);
        }
        return "https://" + bucket + ".s3." + region + ".amazonaws.com/" + key;
    }
}
