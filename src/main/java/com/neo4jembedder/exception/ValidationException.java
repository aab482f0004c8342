package com.neo4jembedder.exception;

/**
 * Exception thrown when caller input is rejected before any I/O happens.
 */
public class ValidationException extends EmbedderException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.VALIDATION;
    }
}
