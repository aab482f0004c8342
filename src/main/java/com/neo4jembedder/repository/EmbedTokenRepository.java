package com.neo4jembedder.repository;

import com.neo4jembedder.model.entity.EmbedToken;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Repository for EmbedToken entities.
 */
@Repository
public interface EmbedTokenRepository extends ReactiveCrudRepository<EmbedToken, UUID> {

    /**
     * Find a token record by its public token string.
     */
    Mono<EmbedToken> findByToken(String token);
}
