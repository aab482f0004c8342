package com.neo4jembedder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Neo4j Embedder Server Application
 *
 * Issues shareable, expiring embed links for Cypher queries and proxies
 * query execution to Neo4j, built with Spring Boot WebFlux.
 */
@SpringBootApplication
public class Neo4jEmbedderApplication {

    public static void main(String[] args) {
        SpringApplication.run(Neo4jEmbedderApplication.class, args);
    }

}
