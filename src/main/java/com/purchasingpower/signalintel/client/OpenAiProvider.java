package com.purchasingpower.signalintel.client;

import com.purchasingpower.signalintel.config.GlobalRetryConfig;
import com.purchasingpower.signalintel.configuration.AppProperties;
import com.purchasingpower.signalintel.configuration.LlmProperties;
import com.purchasingpower.signalintel.core.ProviderType;
import com.purchasingpower.signalintel.core.RequestCredentials;
import com.purchasingpower.signalintel.model.ServiceType;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;

/**
 * Default backend: OpenAI chat completions with bearer authentication.
 *
 * @since 1.0.0
 */
@Component
public class OpenAiProvider extends AbstractChatCompletionsProvider {

    private final LlmProperties.OpenAi config;

    public OpenAiProvider(WebClient.Builder webClientBuilder, GlobalRetryConfig retryConfig, AppProperties props) {
        super(webClientBuilder, retryConfig);
        this.config = props.getLlm().getOpenai();
    }

    @Override
    public ProviderType getProviderType() {
        return ProviderType.OPENAI;
    }

    @Override
    public String getProviderName() {
        return "OpenAI (" + config.getChatModel() + ")";
    }

    @Override
    protected ServiceType serviceType() {
        return ServiceType.OPENAI;
    }

    @Override
    protected URI endpoint(RequestCredentials credentials) {
        return URI.create(stripTrailingSlash(config.getBaseUrl()) + "/v1/chat/completions");
    }

    @Override
    protected void authenticate(HttpHeaders headers, RequestCredentials credentials) {
        headers.setBearerAuth(credentials.getLlmApiKey());
    }

    @Override
    protected String modelName() {
        return config.getChatModel();
    }

    @Override
    protected double inputPricePerMillion() {
        return config.getInputPricePerMillion();
    }

    @Override
    protected double outputPricePerMillion() {
        return config.getOutputPricePerMillion();
    }

    static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
