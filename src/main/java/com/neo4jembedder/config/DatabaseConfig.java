package com.neo4jembedder.config;

import io.r2dbc.spi.ConnectionFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.r2dbc.connection.init.ConnectionFactoryInitializer;
import org.springframework.r2dbc.connection.init.ResourceDatabasePopulator;

/**
 * Database configuration for the R2DBC PostgreSQL token store.
 */
@Configuration
public class DatabaseConfig {

    /**
     * Create the {@code embed_tokens} table on startup.
     * Disable with {@code neo4j-embedder.storage.initialize-schema=false} when migrations are managed elsewhere.
     */
    @Bean
    public ConnectionFactoryInitializer initializer(ConnectionFactory connectionFactory, EmbedderProperties properties) {
        ConnectionFactoryInitializer initializer = new ConnectionFactoryInitializer();
        initializer.setConnectionFactory(connectionFactory);
        initializer.setDatabasePopulator(new ResourceDatabasePopulator(new ClassPathResource("schema.sql")));
        initializer.setEnabled(properties.getStorage().isInitializeSchema());
        return initializer;
    }
}
