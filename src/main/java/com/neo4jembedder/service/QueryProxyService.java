package com.neo4jembedder.service;

import com.neo4jembedder.config.EmbedderProperties;
import com.neo4jembedder.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.reactivestreams.ReactiveSession;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Service for running Cypher directly against Neo4j.
 *
 * Each call borrows one session from the shared driver, drains every record
 * into memory and releases the session whether the call completes, fails or
 * is cancelled. No caching and no retries.
 */
@Slf4j
@Service
public class QueryProxyService {

    private final Driver driver;
    private final GraphValueMapper valueMapper;
    private final Neo4jErrorClassifier errorClassifier;
    private final SessionConfig sessionConfig;
    private final Duration queryTimeout;

    public QueryProxyService(Driver driver,
                             GraphValueMapper valueMapper,
                             Neo4jErrorClassifier errorClassifier,
                             EmbedderProperties properties) {
        this.driver = driver;
        this.valueMapper = valueMapper;
        this.errorClassifier = errorClassifier;
        this.sessionConfig = SessionConfig.forDatabase(properties.getNeo4j().getDatabase());
        this.queryTimeout = properties.getNeo4j().getQueryTimeout();
    }

    /**
     * Execute a query and collect all rows.
     *
     * @param query  Cypher text, passed through unchanged
     * @param params Query parameters; null is treated as empty
     * @return Rows in result order, each keyed by result column
     */
    public Mono<List<Map<String, Object>>> execute(String query, Map<String, Object> params) {
        if (query == null || query.isBlank()) {
            return Mono.error(new ValidationException("cypher", "cypher is required"));
        }
        Map<String, Object> parameters = params == null ? Map.of() : params;

        return Flux.usingWhen(
                        Mono.fromSupplier(() -> driver.session(ReactiveSession.class, sessionConfig)),
                        session -> Flux.from(session.run(query, parameters))
                                .flatMap(result -> Flux.from(result.records())),
                        session -> session.close())
                .map(valueMapper::toRow)
                .collectList()
                .timeout(queryTimeout)
                .doOnSuccess(rows -> log.debug("Proxy query returned {} row(s)", rows.size()))
                .onErrorMap(errorClassifier::classify)
                .doOnError(error -> log.warn("Proxy query failed: {}", error.getMessage()));
    }
}
