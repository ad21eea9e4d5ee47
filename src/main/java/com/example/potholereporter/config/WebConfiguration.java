package com.example.potholereporter.config;

import com.example.potholereporter.service.storage.LocalImageStorage;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Serves locally stored images under {@code /uploads/**}.
 */
@Configuration
public class WebConfiguration implements WebMvcConfigurer {

    private final LocalImageStorage localImageStorage;

    public WebConfiguration(LocalImageStorage localImageStorage) {
        this.localImageStorage = localImageStorage;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String location = localImageStorage.uploadDir().toUri().toString();
        if (!location.endsWith("/")) {
            location = location + "/";
        }
        registry.addResourceHandler(LocalImageStorage.PUBLIC_PREFIX + "**").addResourceLocations(location);
    }
}
