package com.neo4jembedder.model.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of a successful embed creation.
 */
@Value
@Builder
public class CreatedEmbed {
    String token;
    String embedUrl;
    Instant createdAt;
    Instant expiresAt;
    long expiresInSeconds;
}
