package com.neo4jembedder.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response DTO consumed by the viewer page to replay a stored query.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbedDataResponse {
    private String cypherQuery;
    private String token;
    private Instant expiresAt;
}
