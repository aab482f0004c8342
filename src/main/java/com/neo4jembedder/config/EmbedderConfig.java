package com.neo4jembedder.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Application-wide beans shared by the embed and proxy services.
 */
@Configuration
@EnableConfigurationProperties(EmbedderProperties.class)
public class EmbedderConfig {

    /**
     * Token expiry is always computed and compared in UTC.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
