package com.neo4jembedder.util;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Utility class for embed token generation.
 */
public final class TokenGenerator {

    private static final int TOKEN_BYTES = 24;
    private static final int LOG_PREFIX_LENGTH = 6;
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private TokenGenerator() {
    }

    /**
     * Generate a new embed token.
     *
     * @return 32-character URL-safe token (192 random bits)
     */
    public static String generateToken() {
        byte[] randomBytes = new byte[TOKEN_BYTES];
        SECURE_RANDOM.nextBytes(randomBytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes);
    }

    /**
     * Shorten a token for log output so full tokens never land in logs.
     *
     * @param token The embed token
     * @return First characters followed by an ellipsis (e.g., abc123...)
     */
    public static String abbreviate(String token) {
        if (token == null || token.length() <= LOG_PREFIX_LENGTH) {
            return token;
        }
        return token.substring(0, LOG_PREFIX_LENGTH) + "...";
    }
}
