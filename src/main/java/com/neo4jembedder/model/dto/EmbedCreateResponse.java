package com.neo4jembedder.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response DTO for a freshly issued embed link.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbedCreateResponse {
    private String embedUrl;
    private String embedToken;
    private Instant expiresAt;
    private long expiresIn;
}
