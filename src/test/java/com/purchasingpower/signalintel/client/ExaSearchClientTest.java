package com.purchasingpower.signalintel.client;

import com.purchasingpower.signalintel.client.ExaSearchClient.SearchBatch;
import com.purchasingpower.signalintel.configuration.AppProperties;
import com.purchasingpower.signalintel.core.SearchHit;
import com.purchasingpower.signalintel.exception.ProviderException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Exa Search Client Tests")
class ExaSearchClientTest {

    private static final String RESPONSE = """
            {
              "requestId": "b5947044c4b78efa9552a7c89b306d95",
              "results": [
                {"id": "r1", "url": "https://acme.com/press/series-a", "title": "Acme raises $10M",
                 "publishedDate": "2025-06-10T08:00:00.000Z", "score": 0.91, "text": "Acme Inc announced..."},
                {"id": "r2", "url": "https://beta.io/blog", "title": null, "publishedDate": "2025-05-01"},
                {"id": "r3", "url": "", "title": "no url"}
              ],
              "costDollars": {"total": 0.005}
            }""";

    @Test
    @DisplayName("Results map to hits with defaults for missing fields")
    void testSearch() {
        // Given
        StubExchange exchange = StubExchange.ok(RESPONSE);
        ExaSearchClient client = new ExaSearchClient(exchange.builder(), StubExchange.noRetry(), new AppProperties());

        // When
        SearchBatch batch = client.search("acme series a", 25, "exa-key");

        // Then
        assertEquals(2, batch.hits().size());
        assertEquals(0.005, batch.cost(), 1e-9);
        assertEquals("b5947044c4b78efa9552a7c89b306d95", batch.requestId());

        SearchHit acme = batch.hits().get(0);
        assertEquals(0.91, acme.getRelevanceScore(), 1e-9);
        assertEquals(OffsetDateTime.of(2025, 6, 10, 8, 0, 0, 0, ZoneOffset.UTC), acme.getPublishedAt());

        SearchHit beta = batch.hits().get(1);
        assertEquals(0.5, beta.getRelevanceScore(), 1e-9);
        assertEquals("", beta.getTitle());
        assertEquals(2025, beta.getPublishedAt().getYear());

        assertEquals("https://api.exa.ai/search", exchange.lastRequest().url().toString());
        assertEquals("exa-key", exchange.lastRequest().headers().getFirst("x-api-key"));
    }

    @Test
    @DisplayName("HTTP errors surface as provider exceptions with the status")
    void testHttpError() {
        StubExchange exchange = new StubExchange(HttpStatus.UNAUTHORIZED, "{\"error\":\"invalid api key\"}");
        ExaSearchClient client = new ExaSearchClient(exchange.builder(), StubExchange.noRetry(), new AppProperties());

        ProviderException ex = assertThrows(ProviderException.class, () -> client.search("acme", 10, "bad"));

        assertEquals(401, ex.getStatusCode());
        assertTrue(ex.isRejected());
    }

    @Test
    @DisplayName("Unparseable dates become null")
    void testParseDate() {
        assertNull(ExaSearchClient.parseDate("last tuesday"));
        assertNull(ExaSearchClient.parseDate(null));
        assertNotNull(ExaSearchClient.parseDate("2024-11-03"));
    }
}
