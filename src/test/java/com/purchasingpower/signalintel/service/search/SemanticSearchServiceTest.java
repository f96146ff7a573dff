package com.purchasingpower.signalintel.service.search;

import com.purchasingpower.signalintel.client.ExaSearchClient;
import com.purchasingpower.signalintel.client.ExaSearchClient.SearchBatch;
import com.purchasingpower.signalintel.configuration.AppProperties;
import com.purchasingpower.signalintel.core.ProviderType;
import com.purchasingpower.signalintel.core.RequestCredentials;
import com.purchasingpower.signalintel.core.SearchHit;
import com.purchasingpower.signalintel.exception.ProviderException;
import com.purchasingpower.signalintel.model.ServiceType;
import com.purchasingpower.signalintel.service.pipeline.PipelineContext;
import com.purchasingpower.signalintel.service.planning.QueryPlan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("Semantic Search Service Tests")
class SemanticSearchServiceTest {

    private ExaSearchClient client;
    private SemanticSearchService service;
    private PipelineContext context;

    @BeforeEach
    void setUp() {
        client = mock(ExaSearchClient.class);
        service = new SemanticSearchService(client, Runnable::run, new AppProperties());
        context = new PipelineContext("acme", null, RequestCredentials.builder()
                .searchApiKey("exa-key")
                .llmProvider(ProviderType.OPENAI)
                .build());
    }

    private static SearchHit hit(String url, double relevance) {
        return SearchHit.builder().id(url).url(url).title(url).relevanceScore(relevance).build();
    }

    @Test
    @DisplayName("Literal search keeps several hits per company and drops social platforms")
    void testLiteralSearch() {
        // Given
        when(client.search("acme", 25, "exa-key")).thenReturn(new SearchBatch(List.of(
                hit("https://acme.com/press/funding", 0.9),
                hit("https://acme.com/careers", 0.8),
                hit("https://linkedin.com/company/acme", 0.7),
                hit("not a url", 0.6)), 0.005, "req-1"));

        // When
        SearchResults results = service.search(QueryPlan.literal("acme"), context);

        // Then
        assertEquals(2, results.hits().size());
        assertEquals("req-1", results.requestId());
        assertEquals(0.005, context.getCosts().getSearch(), 1e-9);
    }

    @Test
    @DisplayName("Generated queries are merged to the most relevant hit per domain")
    void testParallelMerge() {
        when(client.search(eq("q1"), eq(15), anyString())).thenReturn(new SearchBatch(List.of(
                hit("https://acme.com/a", 0.6),
                hit("https://beta.io/b", 0.7)), 0.005, "req-1"));
        when(client.search(eq("q2"), eq(15), anyString())).thenReturn(new SearchBatch(List.of(
                hit("https://www.acme.com/c", 0.95)), 0.005, "req-2"));

        SearchResults results = service.search(new QueryPlan(true, List.of("q1", "q2"), 0.0), context);

        assertThat(results.hits())
                .extracting(SearchHit::getUrl)
                .containsExactly("https://www.acme.com/c", "https://beta.io/b");
        assertEquals("req-1", results.requestId());
        assertEquals(0.010, context.getCosts().getSearch(), 1e-9);
    }

    @Test
    @DisplayName("One failing sub-query loses only its own hits")
    void testPartialFailure() {
        when(client.search(eq("q1"), anyInt(), anyString()))
                .thenThrow(new ProviderException(ServiceType.EXA, 500, "upstream error", null));
        when(client.search(eq("q2"), anyInt(), anyString()))
                .thenReturn(new SearchBatch(List.of(hit("https://beta.io", 0.5)), 0.005, "req-2"));

        SearchResults results = service.search(new QueryPlan(true, List.of("q1", "q2"), 0.0), context);

        assertEquals(1, results.hits().size());
        assertEquals("req-2", results.requestId());
    }

    @Test
    @DisplayName("The stage fails when every sub-query fails")
    void testAllFail() {
        when(client.search(anyString(), anyInt(), anyString()))
                .thenThrow(new ProviderException(ServiceType.EXA, 401, "invalid key", null));

        ProviderException ex = assertThrows(ProviderException.class,
                () -> service.search(new QueryPlan(true, List.of("q1", "q2"), 0.0), context));
        assertEquals(ServiceType.EXA, ex.getService());
    }

    @Test
    @DisplayName("Domain dedup respects the merge limit")
    void testDedupeLimit() {
        List<SearchHit> hits = List.of(
                hit("https://a.com", 0.1), hit("https://b.com", 0.4),
                hit("https://c.com", 0.3), hit("https://b.com/x", 0.2));

        List<SearchHit> merged = SemanticSearchService.dedupeByDomain(hits, 2);

        assertThat(merged).extracting(SearchHit::getUrl).containsExactly("https://b.com", "https://c.com");
    }
}
