package com.neo4jembedder.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Health check endpoint. Dependency health lives under {@code /actuator/health}.
 */
@RestController
public class HealthController {

    @GetMapping("/")
    public Mono<Map<String, Object>> root() {
        return Mono.just(Map.of(
            "success", true,
            "message", "neo4j-embedder backend",
            "version", "1.0.0"
        ));
    }
}
