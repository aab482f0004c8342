package com.neo4jembedder.exception;

/**
 * Base type for classified service failures.
 * The category decides the HTTP status at the boundary.
 */
public abstract class EmbedderException extends RuntimeException {

    protected EmbedderException(String message) {
        super(message);
    }

    protected EmbedderException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorCategory getCategory();
}
