package com.purchasingpower.signalintel.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.signalintel.config.GlobalRetryConfig;
import com.purchasingpower.signalintel.configuration.AppProperties;
import com.purchasingpower.signalintel.configuration.LlmProperties;
import com.purchasingpower.signalintel.core.ProviderType;
import com.purchasingpower.signalintel.core.RequestCredentials;
import com.purchasingpower.signalintel.exception.ProviderException;
import com.purchasingpower.signalintel.model.CallContext;
import com.purchasingpower.signalintel.model.ServiceType;
import com.purchasingpower.signalintel.util.ExternalCallLogger;
import com.purchasingpower.signalintel.util.LlmJson;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API backend.
 *
 * <p>There is no native JSON mode, so JSON is requested through the prompt and any
 * markdown fence the model wraps around it is removed here.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class AnthropicProvider implements LLMProvider {

    private final WebClient webClient;
    private final GlobalRetryConfig retryConfig;
    private final LlmProperties.Anthropic config;

    public AnthropicProvider(WebClient.Builder webClientBuilder, GlobalRetryConfig retryConfig, AppProperties props) {
        this.config = props.getLlm().getAnthropic();
        this.retryConfig = retryConfig;
        this.webClient = webClientBuilder
                .baseUrl(config.getBaseUrl())
                .defaultHeader("anthropic-version", config.getApiVersion())
                .build();
    }

    @Override
    public LLMCompletion complete(LLMRequest request, RequestCredentials credentials) {
        CallContext call = ExternalCallLogger.startCall(ServiceType.ANTHROPIC, request.getPurpose(), log);
        call.logRequest("model=" + config.getChatModel() + ", prompt length=" + request.getUserPrompt().length());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", config.getChatModel());
        body.put("max_tokens", request.getMaxTokens() != null ? request.getMaxTokens() : config.getMaxTokens());
        body.put("temperature", request.getTemperature());
        if (request.getSystemPrompt() != null) {
            body.put("system", request.getSystemPrompt());
        }
        body.put("messages", List.of(Map.of("role", "user", "content", request.getUserPrompt())));

        try {
            JsonNode response = webClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", credentials.getLlmApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .retryWhen(retryConfig.toRetrySpec())
                    .block();

            if (response == null) {
                throw new ProviderException(ServiceType.ANTHROPIC, "empty response body", null);
            }

            String text = "";
            for (JsonNode block : response.path("content")) {
                if ("text".equals(block.path("type").asText())) {
                    text = block.path("text").asText("");
                    break;
                }
            }
            long inputTokens = response.path("usage").path("input_tokens").asLong(0);
            long outputTokens = response.path("usage").path("output_tokens").asLong(0);

            call.logResponse(ExternalCallLogger.truncate(text, 300));
            return LLMCompletion.builder()
                    .content(LlmJson.stripCodeFences(text))
                    .inputTokens(inputTokens)
                    .outputTokens(outputTokens)
                    .cost(LLMCompletion.estimateCost(inputTokens, outputTokens,
                            config.getInputPricePerMillion(), config.getOutputPricePerMillion()))
                    .build();

        } catch (WebClientResponseException e) {
            call.logError("HTTP " + e.getStatusCode().value(), e);
            throw new ProviderException(ServiceType.ANTHROPIC, e.getStatusCode().value(),
                    ExternalCallLogger.truncate(e.getResponseBodyAsString(), 200), e);
        } catch (ProviderException e) {
            call.logError(e.getMessage(), e);
            throw e;
        } catch (RuntimeException e) {
            call.logError(e.getMessage(), e);
            throw new ProviderException(ServiceType.ANTHROPIC, String.valueOf(e.getMessage()), e);
        }
    }

    @Override
    public ProviderType getProviderType() {
        return ProviderType.ANTHROPIC;
    }

    @Override
    public String getProviderName() {
        return "Anthropic (" + config.getChatModel() + ")";
    }
}
