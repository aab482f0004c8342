package com.neo4jembedder.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Typed settings under the {@code neo4j-embedder} prefix.
 */
@Data
@ConfigurationProperties(prefix = "neo4j-embedder")
public class EmbedderProperties {

    private Embed embed = new Embed();
    private Storage storage = new Storage();
    private Neo4j neo4j = new Neo4j();
    private Proxy proxy = new Proxy();

    @Data
    public static class Embed {
        /** Prefix used to compose {@code embedUrl}; {@code /view/{token}} is appended. */
        private String baseUrl = "http://localhost:8000";
        private int defaultTtlDays = 7;
        private int maxTtlDays = 90;
    }

    @Data
    public static class Storage {
        private Duration timeout = Duration.ofSeconds(5);
        private boolean initializeSchema = true;
    }

    @Data
    public static class Neo4j {
        private String uri = "bolt://localhost:7687";
        private String username = "neo4j";
        private String password = "password";
        private String database = "neo4j";
        private Duration queryTimeout = Duration.ofSeconds(30);
        private Duration connectionTimeout = Duration.ofSeconds(10);
        private Duration connectionAcquisitionTimeout = Duration.ofSeconds(30);
        private int maxConnectionPoolSize = 50;
    }

    @Data
    public static class Proxy {
        /**
         * Report every proxy failure as HTTP 200 with {@code success=false},
         * as older viewer clients expect.
         */
        private boolean legacyErrorEnvelope = false;
    }
}
