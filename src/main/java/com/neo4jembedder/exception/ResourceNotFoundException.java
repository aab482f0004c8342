package com.neo4jembedder.exception;

/**
 * Exception thrown when a requested resource is not found.
 */
public class ResourceNotFoundException extends EmbedderException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String resource, String identifier) {
        super(String.format("%s '%s' not found", resource, identifier));
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.NOT_FOUND;
    }
}
