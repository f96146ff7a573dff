package com.purchasingpower.signalintel.service.cache;

import com.purchasingpower.signalintel.configuration.AppProperties;
import com.purchasingpower.signalintel.core.Candidate;
import com.purchasingpower.signalintel.core.IntelligenceResult;
import com.purchasingpower.signalintel.model.cache.IntelligenceQueryEntity;
import com.purchasingpower.signalintel.repository.IntelligenceQueryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("JPA Result Cache Failure Tests")
class JpaResultCacheFailureTest {

    private IntelligenceQueryRepository repository;
    private JpaResultCache cache;

    @BeforeEach
    void setUp() {
        repository = mock(IntelligenceQueryRepository.class);
        cache = new JpaResultCache(repository, new AppProperties(),
                Clock.fixed(Instant.parse("2025-06-15T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("A failed read is a cache miss")
    void testReadFailureIsMiss() {
        // Given
        when(repository.findByQueryHashAndExpiresAtAfterOrderByCreatedAtDesc(anyString(), any(LocalDateTime.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        // When / Then
        assertTrue(cache.lookup("acme", null, false).isEmpty());
        assertTrue(cache.lookup("acme", "myco.com", true).isEmpty());
    }

    @Test
    @DisplayName("A failed write does not reach the caller")
    void testWriteFailureIsSwallowed() {
        // Given
        when(repository.save(any(IntelligenceQueryEntity.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));
        CachedRun run = CachedRun.builder()
                .query("acme")
                .results(List.of(IntelligenceResult.withoutContact(
                        Candidate.builder().companyName("Acme").companyDomain("acme.com").build())))
                .build();

        // When / Then
        assertDoesNotThrow(() -> cache.store(run));
        verify(repository).save(any(IntelligenceQueryEntity.class));
    }
}
