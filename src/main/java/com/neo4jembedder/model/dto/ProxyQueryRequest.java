package com.neo4jembedder.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request DTO for direct query execution.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProxyQueryRequest {

    @NotBlank(message = "cypher is required")
    private String cypher;

    private Map<String, Object> params;
}
