package com.neo4jembedder.exception;

import java.time.Instant;

/**
 * Exception thrown when an embed token exists but its expiry has passed.
 */
public class EmbedExpiredException extends EmbedderException {

    public EmbedExpiredException(String token, Instant expiresAt) {
        super(String.format("Embed token '%s' expired at %s", token, expiresAt));
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.EXPIRED;
    }
}
