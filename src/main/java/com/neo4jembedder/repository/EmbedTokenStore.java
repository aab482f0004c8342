package com.neo4jembedder.repository;

import com.neo4jembedder.model.entity.EmbedToken;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Durable create/lookup contract for embed tokens. No business rules live here.
 */
public interface EmbedTokenStore {

    /**
     * Persist a new token atomically.
     *
     * @param token     unique public token
     * @param query     query text, stored as given
     * @param createdAt creation instant
     * @param expiresAt expiry instant, strictly after {@code createdAt}
     * @return the stored record, or a {@link com.neo4jembedder.exception.StorageException}
     *         when nothing was written
     */
    Mono<EmbedToken> insert(String token, String query, Instant createdAt, Instant expiresAt);

    /**
     * Look up a token. Completes empty when no record matches.
     */
    Mono<EmbedToken> findByToken(String token);
}
