package com.neo4jembedder.service;

import com.neo4jembedder.config.EmbedderProperties;
import com.neo4jembedder.exception.DownstreamUnavailableException;
import com.neo4jembedder.exception.StorageException;
import com.neo4jembedder.exception.ValidationException;
import com.neo4jembedder.model.domain.CreatedEmbed;
import com.neo4jembedder.model.domain.EmbedResolution;
import com.neo4jembedder.model.domain.ResolvedEmbed;
import com.neo4jembedder.model.entity.EmbedToken;
import com.neo4jembedder.repository.EmbedTokenStore;
import com.neo4jembedder.util.TokenGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Service for issuing and resolving embed tokens.
 * Owns the TTL policy; persistence is delegated to {@link EmbedTokenStore}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbedService {

    private static final String VIEW_PATH = "/view/";

    private final EmbedTokenStore tokenStore;
    private final EmbedderProperties properties;
    private final Clock clock;

    /**
     * Issue a new embed token.
     *
     * @param cypherQuery   Query to replay when the link is opened
     * @param expiresInDays Days of validity; null uses the configured default, 0 means one day
     * @return Issued token, URL and expiry
     */
    public Mono<CreatedEmbed> createEmbed(String cypherQuery, Integer expiresInDays) {
        if (cypherQuery == null || cypherQuery.isBlank()) {
            return Mono.error(new ValidationException("cypherQuery", "cypherQuery is required"));
        }

        int ttlDays;
        try {
            ttlDays = resolveTtlDays(expiresInDays);
        } catch (ValidationException e) {
            return Mono.error(e);
        }

        Duration ttl = Duration.ofDays(ttlDays);
        Instant createdAt = clock.instant();
        Instant expiresAt = createdAt.plus(ttl);
        String token = TokenGenerator.generateToken();

        return tokenStore.insert(token, cypherQuery, createdAt, expiresAt)
                .map(saved -> CreatedEmbed.builder()
                        .token(saved.getToken())
                        .embedUrl(buildEmbedUrl(saved.getToken()))
                        .createdAt(saved.getCreatedAt())
                        .expiresAt(saved.getExpiresAt())
                        .expiresInSeconds(ttl.getSeconds())
                        .build())
                .doOnNext(created -> log.info("Issued embed token {} valid for {} day(s)",
                        TokenGenerator.abbreviate(created.getToken()), ttlDays))
                .onErrorMap(StorageException.class, e ->
                        new DownstreamUnavailableException("Token store unavailable, embed was not created", e));
    }

    /**
     * Resolve a token to its stored query.
     *
     * @param token Public embed token
     * @return Valid, not-found or expired resolution
     */
    public Mono<EmbedResolution> resolveEmbed(String token) {
        if (token == null || token.isBlank()) {
            return Mono.just(EmbedResolution.notFound(token));
        }

        return tokenStore.findByToken(token)
                .map(this::toResolution)
                .defaultIfEmpty(EmbedResolution.notFound(token))
                .doOnNext(resolution -> log.debug("Resolved embed token {}: {}",
                        TokenGenerator.abbreviate(token), resolution.getStatus()))
                .onErrorMap(StorageException.class, e ->
                        new DownstreamUnavailableException("Token store unavailable", e));
    }

    /**
     * Compose the public viewer URL for a token.
     */
    public String buildEmbedUrl(String token) {
        String baseUrl = properties.getEmbed().getBaseUrl();
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return baseUrl + VIEW_PATH + token;
    }

    private EmbedResolution toResolution(EmbedToken record) {
        if (record.isExpiredAt(clock.instant())) {
            return EmbedResolution.expired(record.getToken(), record.getExpiresAt());
        }
        return EmbedResolution.valid(ResolvedEmbed.builder()
                .cypherQuery(record.getCypherQuery())
                .token(record.getToken())
                .expiresAt(record.getExpiresAt())
                .build());
    }

    private int resolveTtlDays(Integer expiresInDays) {
        EmbedderProperties.Embed embed = properties.getEmbed();
        if (expiresInDays == null) {
            return embed.getDefaultTtlDays();
        }
        if (expiresInDays == 0) {
            // Older clients sent 0 for "unset"; never issue a zero-TTL token.
            return 1;
        }
        if (expiresInDays < 0) {
            throw new ValidationException("expiresInDays", "expiresInDays must be at least 1");
        }
        if (expiresInDays > embed.getMaxTtlDays()) {
            throw new ValidationException("expiresInDays",
                    String.format("expiresInDays cannot exceed %d", embed.getMaxTtlDays()));
        }
        return expiresInDays;
    }
}
