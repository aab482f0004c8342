package com.neo4jembedder.config;

import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Config;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Builds the process-wide Neo4j driver. Sessions are borrowed per request
 * from its pool; the driver is closed when the context shuts down.
 */
@Slf4j
@Configuration
public class Neo4jConfig {

    @Bean(destroyMethod = "close")
    public Driver neo4jDriver(EmbedderProperties properties) {
        EmbedderProperties.Neo4j neo4j = properties.getNeo4j();

        Config config = Config.builder()
                .withConnectionTimeout(neo4j.getConnectionTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .withConnectionAcquisitionTimeout(neo4j.getConnectionAcquisitionTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .withMaxConnectionPoolSize(neo4j.getMaxConnectionPoolSize())
                .build();

        log.info("Creating Neo4j driver for {} (database '{}')", neo4j.getUri(), neo4j.getDatabase());
        return GraphDatabase.driver(neo4j.getUri(), AuthTokens.basic(neo4j.getUsername(), neo4j.getPassword()), config);
    }
}
