package com.neo4jembedder.exception;

/**
 * Unexpected failure while running a proxied query.
 */
public class QueryExecutionException extends EmbedderException {

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.INTERNAL;
    }
}
