package com.landregistry.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans for the registry engine.
 */
@Configuration
@EnableConfigurationProperties(LandRegistryProperties.class)
public class LandRegistryConfig {

    /**
     * Clock used for every lifecycle timestamp (review, issuance, processing days).
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
