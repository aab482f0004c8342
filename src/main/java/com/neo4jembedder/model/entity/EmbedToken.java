package com.neo4jembedder.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * Persisted embed token. Rows are written once and never updated;
 * expiry is evaluated when the token is read.
 */
@Value
@Builder
@AllArgsConstructor
@Table("embed_tokens")
public class EmbedToken {

    // Assigned by the database on insert
    @Id
    @With
    UUID id;

    @Column("embed_token")
    String token;

    @Column("cypher_query")
    String cypherQuery;

    @Column("created_at")
    Instant createdAt;

    @Column("expires_at")
    Instant expiresAt;

    public boolean isExpiredAt(Instant now) {
        return expiresAt.isBefore(now);
    }
}
