package com.neo4jembedder.exception;

import com.neo4jembedder.model.dto.ApiResponse;
import com.neo4jembedder.model.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for all REST controllers.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(EmbedderException.class)
    public Mono<ResponseEntity<ApiResponse<Void>>> handleEmbedderException(EmbedderException ex) {
        ErrorCategory category = ex.getCategory();
        if (category.getStatus().is5xxServerError()) {
            log.error("{} error: {}", category, ex.getMessage(), ex);
        } else {
            log.warn("{} error: {}", category, ex.getMessage());
        }
        return respond(category.getStatus(), category.name(), ex.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ApiResponse<Void>>> handleValidationException(WebExchangeBindException ex) {
        String errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        log.warn("Validation error: {}", errors);
        return respond(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION.name(), "Validation failed: " + errors);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ApiResponse<Void>>> handleInputException(ServerWebInputException ex) {
        log.warn("Malformed request: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION.name(), "Malformed request: " + ex.getReason());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiResponse<Void>>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCategory.INTERNAL.name(),
                "Internal server error: " + ex.getMessage());
    }

    private static Mono<ResponseEntity<ApiResponse<Void>>> respond(HttpStatus status, String code, String message) {
        ErrorResponse error = ErrorResponse.builder()
                .code(code)
                .message(message)
                .traceId(UUID.randomUUID().toString())
                .build();
        ApiResponse<Void> body = ApiResponse.failure(error);
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
