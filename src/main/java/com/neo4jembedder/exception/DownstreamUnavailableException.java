package com.neo4jembedder.exception;

/**
 * Exception thrown when the token store or Neo4j cannot be reached in time.
 */
public class DownstreamUnavailableException extends EmbedderException {

    public DownstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.UNAVAILABLE;
    }
}
