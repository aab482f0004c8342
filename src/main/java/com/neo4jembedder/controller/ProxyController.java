package com.neo4jembedder.controller;

import com.neo4jembedder.config.EmbedderProperties;
import com.neo4jembedder.exception.ValidationException;
import com.neo4jembedder.model.dto.ApiResponse;
import com.neo4jembedder.model.dto.ErrorResponse;
import com.neo4jembedder.model.dto.ProxyQueryRequest;
import com.neo4jembedder.service.QueryProxyService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Controller for direct Cypher execution.
 */
@RestController
@RequestMapping("/api/proxy")
@RequiredArgsConstructor
public class ProxyController {

    private final QueryProxyService queryProxyService;
    private final EmbedderProperties properties;

    @PostMapping("/query")
    public Mono<ApiResponse<List<Map<String, Object>>>> query(@Valid @RequestBody ProxyQueryRequest request) {
        Mono<ApiResponse<List<Map<String, Object>>>> response = queryProxyService
                .execute(request.getCypher(), request.getParams())
                .map(ApiResponse::ok);

        if (!properties.getProxy().isLegacyErrorEnvelope()) {
            return response;
        }
        // Legacy clients expect HTTP 200 with success=false for anything past validation
        return response.onErrorResume(error -> !(error instanceof ValidationException),
                error -> Mono.just(ApiResponse.<List<Map<String, Object>>>failure(ErrorResponse.builder()
                        .message(error.getMessage())
                        .build())));
    }
}
