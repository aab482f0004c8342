package com.neo4jembedder.controller;

import com.neo4jembedder.config.EmbedderConfig;
import com.neo4jembedder.exception.DownstreamUnavailableException;
import com.neo4jembedder.service.QueryProxyService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.Map;

import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * ProxyController with the legacy error envelope switched on.
 */
@Import(EmbedderConfig.class)
@WebFluxTest(controllers = ProxyController.class,
        properties = "neo4j-embedder.proxy.legacy-error-envelope=true")
class ProxyControllerLegacyEnvelopeTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private QueryProxyService queryProxyService;

    @Test
    void query_FailureIsReportedWithStatusOk() {
        when(queryProxyService.execute(anyString(), anyMap())).thenReturn(Mono.error(
                new DownstreamUnavailableException("Neo4j service unavailable: connection refused", null)));

        webTestClient.post()
                .uri("/api/proxy/query")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("cypher", "MATCH (n) RETURN n", "params", Map.of()))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.error.message").isEqualTo("Neo4j service unavailable: connection refused")
                .jsonPath("$.data").doesNotExist();
    }

    @Test
    void query_BlankCypherIsStillBadRequest() {
        webTestClient.post()
                .uri("/api/proxy/query")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("cypher", " "))
                .exchange()
                .expectStatus().isBadRequest();
    }
}
