package com.neo4jembedder.model.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Stored query behind a token that is still valid.
 */
@Value
@Builder
public class ResolvedEmbed {
    String cypherQuery;
    String token;
    Instant expiresAt;
}
