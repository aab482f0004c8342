package com.neo4jembedder.repository;

import com.neo4jembedder.config.EmbedderProperties;
import com.neo4jembedder.exception.StorageException;
import com.neo4jembedder.exception.ValidationException;
import com.neo4jembedder.model.entity.EmbedToken;
import io.r2dbc.spi.R2dbcNonTransientResourceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for R2dbcEmbedTokenStore.
 */
@ExtendWith(MockitoExtension.class)
class R2dbcEmbedTokenStoreTest {

    private static final Instant CREATED_AT = Instant.parse("2025-01-01T12:00:00Z");
    private static final Instant EXPIRES_AT = CREATED_AT.plus(Duration.ofDays(7));

    @Mock
    private EmbedTokenRepository repository;

    private R2dbcEmbedTokenStore store;

    @BeforeEach
    void setUp() {
        EmbedderProperties properties = new EmbedderProperties();
        properties.getStorage().setTimeout(Duration.ofMillis(200));
        store = new R2dbcEmbedTokenStore(repository, properties);
    }

    @Test
    void insert_ReturnsStoredRecordWithGeneratedId() {
        UUID id = UUID.randomUUID();
        when(repository.save(any(EmbedToken.class)))
                .thenAnswer(invocation -> Mono.just(invocation.<EmbedToken>getArgument(0).withId(id)));

        StepVerifier.create(store.insert("tok", "MATCH (n) RETURN n", CREATED_AT, EXPIRES_AT))
                .expectNextMatches(saved ->
                        saved.getId().equals(id) &&
                        saved.getToken().equals("tok") &&
                        saved.getCypherQuery().equals("MATCH (n) RETURN n") &&
                        saved.getCreatedAt().equals(CREATED_AT) &&
                        saved.getExpiresAt().equals(EXPIRES_AT))
                .verifyComplete();
    }

    @Test
    void insert_DuplicateToken() {
        when(repository.save(any(EmbedToken.class)))
                .thenReturn(Mono.error(new DataIntegrityViolationException("duplicate key value violates unique constraint")));

        StepVerifier.create(store.insert("tok", "MATCH (n) RETURN n", CREATED_AT, EXPIRES_AT))
                .expectError(StorageException.class)
                .verify();
    }

    @Test
    void insert_RejectsExpiryNotAfterCreation() {
        StepVerifier.create(store.insert("tok", "MATCH (n) RETURN n", CREATED_AT, CREATED_AT))
                .expectError(ValidationException.class)
                .verify();

        verifyNoInteractions(repository);
    }

    @Test
    void findByToken_AbsentCompletesEmpty() {
        when(repository.findByToken("missing")).thenReturn(Mono.empty());

        StepVerifier.create(store.findByToken("missing"))
                .verifyComplete();
    }

    @Test
    void findByToken_ConnectionFailure() {
        when(repository.findByToken("tok"))
                .thenReturn(Mono.error(new R2dbcNonTransientResourceException("Connection refused")));

        StepVerifier.create(store.findByToken("tok"))
                .expectError(StorageException.class)
                .verify();
    }

    @Test
    void findByToken_TimesOut() {
        when(repository.findByToken("tok")).thenReturn(Mono.never());

        StepVerifier.create(store.findByToken("tok"))
                .expectError(StorageException.class)
                .verify(Duration.ofSeconds(5));
    }
}
