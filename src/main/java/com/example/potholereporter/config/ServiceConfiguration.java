package com.example.potholereporter.config;

import com.example.potholereporter.service.estimation.GeometricEstimator;
import com.example.potholereporter.service.estimation.LaneWidthScaleModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ServiceConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public GeometricEstimator geometricEstimator(PotholeProperties properties) {
        return new GeometricEstimator(new LaneWidthScaleModel(properties.estimation().laneWidthMeters()));
    }
}
