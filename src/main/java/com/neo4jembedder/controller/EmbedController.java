package com.neo4jembedder.controller;

import com.neo4jembedder.exception.EmbedExpiredException;
import com.neo4jembedder.exception.ResourceNotFoundException;
import com.neo4jembedder.model.domain.EmbedResolution;
import com.neo4jembedder.model.domain.ResolvedEmbed;
import com.neo4jembedder.model.dto.ApiResponse;
import com.neo4jembedder.model.dto.EmbedCreateRequest;
import com.neo4jembedder.model.dto.EmbedCreateResponse;
import com.neo4jembedder.model.dto.EmbedDataResponse;
import com.neo4jembedder.service.EmbedService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/**
 * Controller for creating embed links and reading their stored query.
 */
@RestController
@RequestMapping("/api/embed")
@RequiredArgsConstructor
public class EmbedController {

    private final EmbedService embedService;

    @PostMapping
    public Mono<ApiResponse<EmbedCreateResponse>> createEmbed(@Valid @RequestBody EmbedCreateRequest request) {
        return embedService.createEmbed(request.getCypherQuery(), request.getExpiresInDays())
                .map(created -> ApiResponse.ok(EmbedCreateResponse.builder()
                        .embedUrl(created.getEmbedUrl())
                        .embedToken(created.getToken())
                        .expiresAt(created.getExpiresAt())
                        .expiresIn(created.getExpiresInSeconds())
                        .build()));
    }

    /**
     * Used by the viewer page: 200 with the query, 404 for unknown tokens, 410 once expired.
     */
    @GetMapping("/{token}")
    public Mono<ApiResponse<EmbedDataResponse>> getEmbedData(@PathVariable String token) {
        return embedService.resolveEmbed(token)
                .flatMap(EmbedController::toEmbedData);
    }

    private static Mono<ApiResponse<EmbedDataResponse>> toEmbedData(EmbedResolution resolution) {
        switch (resolution.getStatus()) {
            case VALID:
                return Mono.just(ApiResponse.ok(toResponse(resolution.getEmbed())));
            case EXPIRED:
                return Mono.error(new EmbedExpiredException(resolution.getToken(), resolution.getExpiresAt()));
            default:
                return Mono.error(new ResourceNotFoundException("Embed token", resolution.getToken()));
        }
    }

    private static EmbedDataResponse toResponse(ResolvedEmbed embed) {
        return EmbedDataResponse.builder()
                .cypherQuery(embed.getCypherQuery())
                .token(embed.getToken())
                .expiresAt(embed.getExpiresAt())
                .build();
    }
}
