package com.neo4jembedder.repository;

import com.neo4jembedder.exception.StorageException;
import com.neo4jembedder.exception.ValidationException;
import com.neo4jembedder.model.entity.EmbedToken;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed store used by service tests; mirrors the table's unique and check constraints.
 */
public class InMemoryEmbedTokenStore implements EmbedTokenStore {

    private final Map<String, EmbedToken> records = new ConcurrentHashMap<>();

    @Override
    public Mono<EmbedToken> insert(String token, String query, Instant createdAt, Instant expiresAt) {
        return Mono.defer(() -> {
            if (!expiresAt.isAfter(createdAt)) {
                return Mono.error(new ValidationException("expiresAt", "expiresAt must be after createdAt"));
            }
            EmbedToken record = new EmbedToken(UUID.randomUUID(), token, query, createdAt, expiresAt);
            if (records.putIfAbsent(token, record) != null) {
                return Mono.error(new StorageException("Duplicate token", null));
            }
            return Mono.just(record);
        });
    }

    @Override
    public Mono<EmbedToken> findByToken(String token) {
        return Mono.justOrEmpty(records.get(token));
    }

    public int size() {
        return records.size();
    }
}
