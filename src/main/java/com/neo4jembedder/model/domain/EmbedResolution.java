package com.neo4jembedder.model.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Instant;

/**
 * Three-way result of looking up an embed token.
 * Not-found and expired are ordinary outcomes here, not errors.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EmbedResolution {

    public enum Status {
        VALID,
        NOT_FOUND,
        EXPIRED
    }

    Status status;
    String token;

    /** Only set when {@link Status#VALID}. */
    ResolvedEmbed embed;

    /** Set for valid and expired tokens. */
    Instant expiresAt;

    public static EmbedResolution valid(ResolvedEmbed embed) {
        return new EmbedResolution(Status.VALID, embed.getToken(), embed, embed.getExpiresAt());
    }

    public static EmbedResolution notFound(String token) {
        return new EmbedResolution(Status.NOT_FOUND, token, null, null);
    }

    public static EmbedResolution expired(String token, Instant expiresAt) {
        return new EmbedResolution(Status.EXPIRED, token, null, expiresAt);
    }

    public boolean isValid() {
        return status == Status.VALID;
    }
}
