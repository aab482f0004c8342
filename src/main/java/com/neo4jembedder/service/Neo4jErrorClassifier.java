package com.neo4jembedder.service;

import com.neo4jembedder.exception.DownstreamUnavailableException;
import com.neo4jembedder.exception.EmbedderException;
import com.neo4jembedder.exception.QueryExecutionException;
import com.neo4jembedder.exception.QueryRejectedException;
import org.neo4j.driver.exceptions.AuthenticationException;
import org.neo4j.driver.exceptions.Neo4jException;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.SessionExpiredException;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeoutException;

/**
 * Maps driver and runtime failures onto the service error categories.
 * Checks run in priority order: connectivity first, then errors reported by
 * the server about the query, then everything else.
 */
@Component
public class Neo4jErrorClassifier {

    static final String DATABASE_UNAVAILABLE = "Neo.TransientError.General.DatabaseUnavailable";

    private static final String CLIENT_ERROR_PREFIX = "Neo.ClientError.";
    private static final String TRANSIENT_ERROR_PREFIX = "Neo.TransientError.";

    public EmbedderException classify(Throwable error) {
        if (error instanceof EmbedderException) {
            return (EmbedderException) error;
        }
        if (isUnavailable(error)) {
            return new DownstreamUnavailableException("Neo4j service unavailable: " + error.getMessage(), error);
        }
        if (isRejectedByServer(error)) {
            Neo4jException serverError = (Neo4jException) error;
            return new QueryRejectedException(serverError.code(),
                    "Cypher query error: " + serverError.getMessage(), error);
        }
        return new QueryExecutionException("Unexpected error: " + error.getMessage(), error);
    }

    private static boolean isUnavailable(Throwable error) {
        // AuthenticationException carries a ClientError code and must be caught here first
        return error instanceof ServiceUnavailableException
                || error instanceof SessionExpiredException
                || error instanceof AuthenticationException
                || error instanceof TimeoutException
                || (error instanceof Neo4jException && DATABASE_UNAVAILABLE.equals(((Neo4jException) error).code()));
    }

    /**
     * Syntax and semantic errors, constraint violations, deadlocks and lock
     * timeouts: the server was reachable and refused this query. Driver-side
     * failures such as a consumed result have no server status code.
     */
    private static boolean isRejectedByServer(Throwable error) {
        if (!(error instanceof Neo4jException)) {
            return false;
        }
        String code = ((Neo4jException) error).code();
        return code != null && (code.startsWith(CLIENT_ERROR_PREFIX) || code.startsWith(TRANSIENT_ERROR_PREFIX));
    }
}
