package com.purchasingpower.signalintel.service.cache;

import com.purchasingpower.signalintel.configuration.AppProperties;
import com.purchasingpower.signalintel.core.Candidate;
import com.purchasingpower.signalintel.core.EnrichedContact;
import com.purchasingpower.signalintel.core.IntelligenceResult;
import com.purchasingpower.signalintel.core.Seniority;
import com.purchasingpower.signalintel.core.SignalType;
import com.purchasingpower.signalintel.core.SourceType;
import com.purchasingpower.signalintel.repository.IntelligenceQueryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@DisplayName("JPA Result Cache Tests")
class JpaResultCacheTest {

    private static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");

    @Autowired
    private IntelligenceQueryRepository repository;

    private AppProperties props;
    private JpaResultCache cache;

    @BeforeEach
    void setUp() {
        props = new AppProperties();
        cache = cacheAt(NOW);
    }

    private JpaResultCache cacheAt(Instant instant) {
        return new JpaResultCache(repository, props, Clock.fixed(instant, ZoneOffset.UTC));
    }

    private static IntelligenceResult result(String domain, EnrichedContact contact) {
        Candidate company = Candidate.builder()
                .companyName("Acme")
                .companyDomain(domain)
                .signalType(SignalType.FUNDING)
                .signalHeadline("Raised $10M Series A")
                .signalDate(LocalDate.of(2025, 6, 10))
                .sourceUrl("https://" + domain + "/press")
                .sourceType(SourceType.PRESS_RELEASE)
                .sourceTitle("Acme raises $10M")
                .matchScore(82)
                .confidence(0.9)
                .opportunityScore(40)
                .opportunityReason("Fresh budget available")
                .build();
        return new IntelligenceResult(company, contact);
    }

    private static CachedRun run(String query, List<IntelligenceResult> results) {
        return CachedRun.builder()
                .query(query)
                .results(results)
                .searchRequestId("req-1")
                .searchCost(0.005)
                .modelCost(0.002)
                .enrichmentCost(0.01)
                .latencyMs(1234)
                .build();
    }

    @Test
    @DisplayName("Stored results come back in rank order with their contact")
    void testStoreAndLookup() {
        // Given
        EnrichedContact dana = EnrichedContact.builder()
                .fullName("Dana Reyes").firstName("Dana").title("CEO").email("dana@acme.com")
                .seniority(Seniority.C_SUITE).source(EnrichedContact.SOURCE_APOLLO).build();
        cache.store(run("Fintech Series A", List.of(result("acme.com", dana), result("beta.io", null))));

        // When
        Optional<List<IntelligenceResult>> hit = cache.lookup("  fintech series a ", null, true);

        // Then
        assertTrue(hit.isPresent());
        List<IntelligenceResult> results = hit.get();
        assertEquals(2, results.size());
        assertEquals("acme.com", results.get(0).getCompany().getCompanyDomain());
        assertEquals(SignalType.FUNDING, results.get(0).getCompany().getSignalType());
        assertEquals(40, results.get(0).getCompany().getOpportunityScore());
        assertEquals("dana@acme.com", results.get(0).getContact().getEmail());
        assertEquals(Seniority.C_SUITE, results.get(0).getContact().getSeniority());
        assertNull(results.get(1).getContact());
    }

    @Test
    @DisplayName("Entries without contacts only satisfy requests that do not want contacts")
    void testContactAwareness() {
        cache.store(run("acme", List.of(result("acme.com", null))));

        assertTrue(cache.lookup("acme", null, false).isPresent());
        assertTrue(cache.lookup("acme", null, true).isEmpty());
    }

    @Test
    @DisplayName("The excluded domain is part of the key")
    void testExcludedDomainInKey() {
        cache.store(run("acme", List.of(result("acme.com", null))));

        assertTrue(cache.lookup("acme", "myco.com", false).isEmpty());
        assertNotEquals(CacheKeys.of("acme", null), CacheKeys.of("acme", "myco.com"));
        assertEquals(CacheKeys.of("acme", null), CacheKeys.of(" ACME ", ""));
    }

    @Test
    @DisplayName("Entries expire after the TTL and are removed by the purge")
    void testExpiryAndPurge() {
        cache.store(run("acme", List.of(result("acme.com", null))));
        JpaResultCache tomorrow = cacheAt(NOW.plusSeconds(25 * 3600));

        assertTrue(tomorrow.lookup("acme", null, false).isEmpty());
        assertEquals(0, cache.purgeExpired());
        assertEquals(1, tomorrow.purgeExpired());
        assertEquals(0, repository.count());
    }

    @Test
    @DisplayName("Empty result sets are never cached")
    void testEmptyNotStored() {
        cache.store(run("nothing here", List.of()));

        assertEquals(0, repository.count());
    }

    @Test
    @DisplayName("A disabled cache neither reads nor writes")
    void testDisabled() {
        props.getCache().setEnabled(false);
        JpaResultCache disabled = cacheAt(NOW);

        disabled.store(run("acme", List.of(result("acme.com", null))));

        assertEquals(0, repository.count());
        assertTrue(disabled.lookup("acme", null, false).isEmpty());
    }
}
