package com.neo4jembedder.exception;

/**
 * Exception thrown when Neo4j refuses a query as syntactically or semantically invalid.
 */
public class QueryRejectedException extends EmbedderException {

    private final String statusCode;

    public QueryRejectedException(String statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * Neo4j status code, e.g. {@code Neo.ClientError.Statement.SyntaxError}.
     */
    public String getStatusCode() {
        return statusCode;
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.QUERY_REJECTED;
    }
}
