package com.neo4jembedder.exception;

/**
 * Failure of the relational token store: constraint violation, lost connection or timeout.
 * A failed insert never leaves a partial record behind.
 */
public class StorageException extends EmbedderException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.UNAVAILABLE;
    }
}
