package com.neo4jembedder.controller;

import com.neo4jembedder.exception.DownstreamUnavailableException;
import com.neo4jembedder.model.domain.EmbedResolution;
import com.neo4jembedder.service.EmbedService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import reactor.core.publisher.Mono;

/**
 * Serves the viewer page variant matching a token's state.
 * The page itself fetches the query from {@code /api/embed/{token}}.
 * A token store outage is answered with an HTML 503 page, since the JSON
 * error body cannot be served under {@code text/html}.
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class ViewController {

    static final Resource EMBED_PAGE = new ClassPathResource("public/embed.html");
    static final Resource NOT_FOUND_PAGE = new ClassPathResource("public/embed-not-found.html");
    static final Resource EXPIRED_PAGE = new ClassPathResource("public/embed-expired.html");
    static final Resource UNAVAILABLE_PAGE = new ClassPathResource("public/embed-unavailable.html");

    private final EmbedService embedService;

    @GetMapping(value = "/view/{token}", produces = MediaType.TEXT_HTML_VALUE)
    public Mono<ResponseEntity<Resource>> viewEmbed(@PathVariable String token) {
        return embedService.resolveEmbed(token)
                .map(resolution -> ResponseEntity.ok()
                        .contentType(MediaType.TEXT_HTML)
                        .body(pageFor(resolution)))
                .onErrorResume(DownstreamUnavailableException.class, error -> {
                    log.warn("Cannot render embed view: {}", error.getMessage());
                    return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                            .contentType(MediaType.TEXT_HTML)
                            .body(UNAVAILABLE_PAGE));
                });
    }

    private static Resource pageFor(EmbedResolution resolution) {
        switch (resolution.getStatus()) {
            case VALID:
                return EMBED_PAGE;
            case EXPIRED:
                return EXPIRED_PAGE;
            default:
                return NOT_FOUND_PAGE;
        }
    }
}
