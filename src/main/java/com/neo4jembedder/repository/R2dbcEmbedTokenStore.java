package com.neo4jembedder.repository;

import com.neo4jembedder.config.EmbedderProperties;
import com.neo4jembedder.exception.StorageException;
import com.neo4jembedder.exception.ValidationException;
import com.neo4jembedder.model.entity.EmbedToken;
import com.neo4jembedder.util.TokenGenerator;
import io.r2dbc.spi.R2dbcException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeoutException;

/**
 * {@link EmbedTokenStore} backed by the {@code embed_tokens} PostgreSQL table.
 * Every call is bounded by the configured storage timeout.
 */
@Slf4j
@Component
public class R2dbcEmbedTokenStore implements EmbedTokenStore {

    private final EmbedTokenRepository repository;
    private final Duration timeout;

    public R2dbcEmbedTokenStore(EmbedTokenRepository repository, EmbedderProperties properties) {
        this.repository = repository;
        this.timeout = properties.getStorage().getTimeout();
    }

    @Override
    public Mono<EmbedToken> insert(String token, String query, Instant createdAt, Instant expiresAt) {
        if (!expiresAt.isAfter(createdAt)) {
            return Mono.error(new ValidationException("expiresAt", "expiresAt must be after createdAt"));
        }

        EmbedToken entity = EmbedToken.builder()
                .token(token)
                .cypherQuery(query)
                .createdAt(createdAt)
                .expiresAt(expiresAt)
                .build();

        return repository.save(entity)
                .timeout(timeout)
                .onErrorMap(R2dbcEmbedTokenStore::isStorageFailure, error -> {
                    log.error("Failed to insert embed token {}", TokenGenerator.abbreviate(token), error);
                    return new StorageException("Failed to persist embed token", error);
                });
    }

    @Override
    public Mono<EmbedToken> findByToken(String token) {
        return repository.findByToken(token)
                .timeout(timeout)
                .onErrorMap(R2dbcEmbedTokenStore::isStorageFailure, error -> {
                    log.error("Failed to look up embed token {}", TokenGenerator.abbreviate(token), error);
                    return new StorageException("Failed to look up embed token", error);
                });
    }

    private static boolean isStorageFailure(Throwable error) {
        return error instanceof DataAccessException
                || error instanceof R2dbcException
                || error instanceof TimeoutException;
    }
}
