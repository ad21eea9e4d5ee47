package com.example.potholereporter.config;

import com.example.potholereporter.service.storage.ImageStorage;
import com.example.potholereporter.service.storage.LocalImageStorage;
import com.example.potholereporter.service.storage.S3ImageStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;
import java.nio.file.Path;

@Configuration
public class StorageConfiguration {

    private static final Logger log = LoggerFactory.getLogger(StorageConfiguration.class);

    @Bean
    public LocalImageStorage localImageStorage(PotholeProperties properties) {
        return new LocalImageStorage(Path.of(properties.storage().uploadDir()));
    }

    @Bean
    @ConditionalOnProperty(prefix = "pothole.storage", name = "mode", havingValue = "s3")
    public S3Client s3Client(PotholeProperties properties) {
        PotholeProperties.StorageProperties storage = properties.storage();
        S3ClientBuilder builder = S3Client.builder().region(Region.of(storage.region()));
        if (storage.endpoint() != null && !storage.endpoint().isBlank()) {
            builder.endpointOverride(URI.create(storage.endpoint())).forcePathStyle(true);
        }
        return builder.build();
    }

    @Bean
    @Primary
    public ImageStorage imageStorage(PotholeProperties properties, LocalImageStorage localImageStorage,
                                     ObjectProvider<S3Client> s3Client) {
        PotholeProperties.StorageProperties storage = properties.storage();
        S3Client client = s3Client.getIfAvailable();
        if (storage.mode() == PotholeProperties.StorageMode.S3 && client != null) {
            log.info("Storing images in S3 bucket {} ({})", storage.bucket(), storage.region());
            return new S3ImageStorage(client, storage.bucket(), storage.region(), localImageStorage);
        }
        log.info("Storing images locally in {}", localImageStorage.uploadDir());
        return localImageStorage;
    }
}
