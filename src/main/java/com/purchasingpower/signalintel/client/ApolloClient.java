package com.purchasingpower.signalintel.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.signalintel.config.GlobalRetryConfig;
import com.purchasingpower.signalintel.configuration.AppProperties;
import com.purchasingpower.signalintel.exception.ProviderException;
import com.purchasingpower.signalintel.model.CallContext;
import com.purchasingpower.signalintel.model.ServiceType;
import com.purchasingpower.signalintel.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Client for Apollo people search and person enrichment.
 *
 * <p>A lookup that fails for any reason other than a rejected key is reported as a miss.
 * Rejected keys (401/403) throw {@link ProviderException} so the caller can stop using the
 * capability for the rest of the request.
 */
@Slf4j
@Component
public class ApolloClient {

    private final WebClient webClient;
    private final GlobalRetryConfig retryConfig;
    private final ObjectMapper objectMapper;

    public ApolloClient(WebClient.Builder webClientBuilder, GlobalRetryConfig retryConfig,
                        AppProperties props, ObjectMapper objectMapper) {
        this.webClient = webClientBuilder.baseUrl(props.getEnrichment().getBaseUrl()).build();
        this.retryConfig = retryConfig;
        this.objectMapper = objectMapper;
    }

    /**
     * Search criteria for one people-search attempt. Exactly one of {@code domain} and
     * {@code organizationName} is expected to be set.
     */
    public record PeopleQuery(String domain, String organizationName,
                              List<String> titles, List<String> seniorities) {
    }

    /**
     * Best single match for the query, or empty when nobody matched or the call failed.
     */
    public Optional<ApolloPerson> searchPeople(PeopleQuery query, String apiKey) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("page", 1);
        body.put("per_page", 1);
        if (query.domain() != null) {
            body.put("q_organization_domains_list", List.of(query.domain()));
        }
        if (query.organizationName() != null) {
            body.put("q_organization_name", query.organizationName());
        }
        body.put("person_titles", query.titles());
        body.put("person_seniorities", query.seniorities());

        String target = query.domain() != null ? query.domain() : query.organizationName();
        JsonNode response = post("/v1/mixed_people/api_search", "people search " + target, body, apiKey);
        if (response == null) {
            return Optional.empty();
        }
        JsonNode first = response.path("people").path(0);
        if (first.isMissingNode() || first.isNull()) {
            return Optional.empty();
        }
        return readPerson(first);
    }

    /**
     * Full person record by id; carries the work email when Apollo has one.
     */
    public Optional<ApolloPerson> enrichPerson(String personId, String apiKey) {
        JsonNode response = post("/v1/people/enrich", "enrich " + personId, Map.of("id", personId), apiKey);
        if (response == null) {
            return Optional.empty();
        }
        JsonNode person = response.path("person");
        if (person.isMissingNode() || person.isNull()) {
            return Optional.empty();
        }
        return readPerson(person);
    }

    private Optional<ApolloPerson> readPerson(JsonNode node) {
        try {
            return Optional.of(objectMapper.convertValue(node, ApolloPerson.class));
        } catch (IllegalArgumentException e) {
            log.warn("⚠️ Unreadable Apollo person payload, treating as no match: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private JsonNode post(String path, String operation, Object body, String apiKey) {
        CallContext call = ExternalCallLogger.startCall(ServiceType.APOLLO, operation, log);
        call.logRequest(null);
        try {
            JsonNode response = webClient.post()
                    .uri(path)
                    .header("x-api-key", apiKey)
                    .header("Cache-Control", "no-cache")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .retryWhen(retryConfig.toRetrySpec())
                    .block();
            call.logResponse(null);
            return response;

        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            call.logError("HTTP " + status, e);
            ProviderException failure = new ProviderException(ServiceType.APOLLO, status,
                    ExternalCallLogger.truncate(e.getResponseBodyAsString(), 200), e);
            if (failure.isRejected()) {
                throw failure;
            }
            return null;
        } catch (RuntimeException e) {
            call.logError(e.getMessage(), e);
            return null;
        }
    }
}
