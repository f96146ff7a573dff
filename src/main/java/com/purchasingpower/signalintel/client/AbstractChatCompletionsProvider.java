package com.purchasingpower.signalintel.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.signalintel.config.GlobalRetryConfig;
import com.purchasingpower.signalintel.core.RequestCredentials;
import com.purchasingpower.signalintel.exception.ProviderException;
import com.purchasingpower.signalintel.model.CallContext;
import com.purchasingpower.signalintel.model.ServiceType;
import com.purchasingpower.signalintel.util.ExternalCallLogger;
import com.purchasingpower.signalintel.util.LlmJson;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared transport for backends speaking the OpenAI chat-completions wire format.
 * Subclasses supply endpoint, authentication, model field and pricing.
 */
@Slf4j
public abstract class AbstractChatCompletionsProvider implements LLMProvider {

    private final WebClient webClient;
    private final GlobalRetryConfig retryConfig;

    protected AbstractChatCompletionsProvider(WebClient.Builder webClientBuilder, GlobalRetryConfig retryConfig) {
        this.webClient = webClientBuilder.build();
        this.retryConfig = retryConfig;
    }

    protected abstract ServiceType serviceType();

    protected abstract URI endpoint(RequestCredentials credentials);

    protected abstract void authenticate(HttpHeaders headers, RequestCredentials credentials);

    /**
     * Model name placed in the request body, or {@code null} when the endpoint implies it.
     */
    protected abstract String modelName();

    protected abstract double inputPricePerMillion();

    protected abstract double outputPricePerMillion();

    @Override
    public LLMCompletion complete(LLMRequest request, RequestCredentials credentials) {
        CallContext call = ExternalCallLogger.startCall(serviceType(), request.getPurpose(), log);
        call.logRequest("prompt length=" + request.getUserPrompt().length());

        try {
            JsonNode response = webClient.post()
                    .uri(endpoint(credentials))
                    .headers(headers -> authenticate(headers, credentials))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(buildBody(request))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .retryWhen(retryConfig.toRetrySpec())
                    .block();

            if (response == null) {
                throw new ProviderException(serviceType(), "empty response body", null);
            }

            String content = response.path("choices").path(0).path("message").path("content").asText("");
            long inputTokens = response.path("usage").path("prompt_tokens").asLong(0);
            long outputTokens = response.path("usage").path("completion_tokens").asLong(0);

            call.logResponse(ExternalCallLogger.truncate(content, 300));
            return LLMCompletion.builder()
                    .content(LlmJson.stripCodeFences(content))
                    .inputTokens(inputTokens)
                    .outputTokens(outputTokens)
                    .cost(LLMCompletion.estimateCost(inputTokens, outputTokens,
                            inputPricePerMillion(), outputPricePerMillion()))
                    .build();

        } catch (WebClientResponseException e) {
            call.logError("HTTP " + e.getStatusCode().value(), e);
            throw new ProviderException(serviceType(), e.getStatusCode().value(),
                    ExternalCallLogger.truncate(e.getResponseBodyAsString(), 200), e);
        } catch (ProviderException e) {
            call.logError(e.getMessage(), e);
            throw e;
        } catch (RuntimeException e) {
            call.logError(e.getMessage(), e);
            throw new ProviderException(serviceType(), String.valueOf(e.getMessage()), e);
        }
    }

    private Map<String, Object> buildBody(LLMRequest request) {
        List<Map<String, String>> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null) {
            messages.add(Map.of("role", "system", "content", request.getSystemPrompt()));
        }
        messages.add(Map.of("role", "user", "content", request.getUserPrompt()));

        Map<String, Object> body = new LinkedHashMap<>();
        if (modelName() != null) {
            body.put("model", modelName());
        }
        body.put("messages", messages);
        body.put("temperature", request.getTemperature());
        if (request.getMaxTokens() != null) {
            body.put("max_tokens", request.getMaxTokens());
        }
        if (request.isJsonMode()) {
            body.put("response_format", Map.of("type", "json_object"));
        }
        return body;
    }
}
