package com.purchasingpower.signalintel.client;

import com.purchasingpower.signalintel.config.GlobalRetryConfig;
import com.purchasingpower.signalintel.configuration.AppProperties;
import com.purchasingpower.signalintel.core.SearchHit;
import com.purchasingpower.signalintel.exception.ProviderException;
import com.purchasingpower.signalintel.model.CallContext;
import com.purchasingpower.signalintel.model.ServiceType;
import com.purchasingpower.signalintel.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Client for the Exa neural search API.
 *
 * <p>One call per query; the caller decides concurrency. Any non-2xx answer or transport
 * failure surfaces as {@link ProviderException}.
 */
@Slf4j
@Component
public class ExaSearchClient {

    private static final double DEFAULT_RELEVANCE = 0.5;

    private final WebClient webClient;
    private final GlobalRetryConfig retryConfig;

    public ExaSearchClient(WebClient.Builder webClientBuilder, GlobalRetryConfig retryConfig, AppProperties props) {
        this.webClient = webClientBuilder.baseUrl(props.getSearch().getBaseUrl()).build();
        this.retryConfig = retryConfig;
    }

    /**
     * Hits of one search call together with what the provider billed for it.
     */
    public record SearchBatch(List<SearchHit> hits, double cost, String requestId) {

        public static SearchBatch empty() {
            return new SearchBatch(List.of(), 0.0, null);
        }
    }

    public SearchBatch search(String query, int numResults, String apiKey) {
        CallContext call = ExternalCallLogger.startCall(ServiceType.EXA, "search", log);
        call.logRequest("query=\"" + ExternalCallLogger.truncate(query, 120) + "\", numResults=" + numResults);

        Map<String, Object> body = Map.of(
                "query", query,
                "numResults", numResults,
                "type", "neural",
                "contents", Map.of("text", true));

        try {
            ExaSearchResponse response = webClient.post()
                    .uri("/search")
                    .header("x-api-key", apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(ExaSearchResponse.class)
                    .retryWhen(retryConfig.toRetrySpec())
                    .block();

            if (response == null) {
                call.logResponse("empty body");
                return SearchBatch.empty();
            }

            List<SearchHit> hits = new ArrayList<>();
            if (response.results() != null) {
                for (ExaSearchResponse.Result result : response.results()) {
                    if (result.url() == null || result.url().isBlank()) {
                        continue;
                    }
                    hits.add(toHit(result));
                }
            }
            double cost = response.costDollars() != null && response.costDollars().total() != null
                    ? response.costDollars().total()
                    : 0.0;

            call.logResponse(hits.size() + " hits, requestId=" + response.requestId());
            return new SearchBatch(hits, cost, response.requestId());

        } catch (WebClientResponseException e) {
            call.logError("HTTP " + e.getStatusCode().value(), e);
            throw new ProviderException(ServiceType.EXA, e.getStatusCode().value(),
                    ExternalCallLogger.truncate(e.getResponseBodyAsString(), 200), e);
        } catch (RuntimeException e) {
            call.logError(e.getMessage(), e);
            throw new ProviderException(ServiceType.EXA, String.valueOf(e.getMessage()), e);
        }
    }

    private static SearchHit toHit(ExaSearchResponse.Result result) {
        return SearchHit.builder()
                .id(result.id() != null ? result.id() : result.url())
                .url(result.url())
                .title(result.title() != null ? result.title() : "")
                .publishedAt(parseDate(result.publishedDate()))
                .relevanceScore(result.score() != null ? result.score() : DEFAULT_RELEVANCE)
                .snippetText(result.text())
                .build();
    }

    static OffsetDateTime parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value)
                        .atStartOfDay().atOffset(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                log.debug("Unparseable publishedDate '{}'", value);
                return null;
            }
        }
    }
}
