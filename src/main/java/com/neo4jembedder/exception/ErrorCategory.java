package com.neo4jembedder.exception;

import org.springframework.http.HttpStatus;

/**
 * Classification of every failure the service reports to its callers.
 */
public enum ErrorCategory {

    VALIDATION(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    EXPIRED(HttpStatus.GONE),
    QUERY_REJECTED(HttpStatus.BAD_REQUEST),
    UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCategory(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
