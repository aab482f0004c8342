package com.neo4jembedder.model.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating an embed link.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbedCreateRequest {

    @NotBlank(message = "cypherQuery is required")
    private String cypherQuery;

    /**
     * Days until the link expires. Absent means the configured default.
     */
    private Integer expiresInDays;
}
