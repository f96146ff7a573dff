package com.purchasingpower.signalintel.client;

import com.purchasingpower.signalintel.config.GlobalRetryConfig;
import com.purchasingpower.signalintel.configuration.AppProperties;
import com.purchasingpower.signalintel.configuration.LlmProperties;
import com.purchasingpower.signalintel.core.ProviderType;
import com.purchasingpower.signalintel.core.RequestCredentials;
import com.purchasingpower.signalintel.model.ServiceType;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;

/**
 * Enterprise-hosted OpenAI models. Same wire format as {@link OpenAiProvider}; the model is
 * implied by the deployment in the URL and the key travels in the {@code api-key} header.
 *
 * @since 1.0.0
 */
@Component
public class AzureOpenAiProvider extends AbstractChatCompletionsProvider {

    private final LlmProperties.Azure config;

    public AzureOpenAiProvider(WebClient.Builder webClientBuilder, GlobalRetryConfig retryConfig, AppProperties props) {
        super(webClientBuilder, retryConfig);
        this.config = props.getLlm().getAzure();
    }

    @Override
    public ProviderType getProviderType() {
        return ProviderType.AZURE;
    }

    @Override
    public String getProviderName() {
        return "Azure OpenAI";
    }

    @Override
    protected ServiceType serviceType() {
        return ServiceType.AZURE_OPENAI;
    }

    @Override
    protected URI endpoint(RequestCredentials credentials) {
        return UriComponentsBuilder.fromHttpUrl(OpenAiProvider.stripTrailingSlash(credentials.getLlmEndpoint()))
                .path("/openai/deployments/{deployment}/chat/completions")
                .queryParam("api-version", config.getApiVersion())
                .buildAndExpand(credentials.getLlmDeployment())
                .toUri();
    }

    @Override
    protected void authenticate(HttpHeaders headers, RequestCredentials credentials) {
        headers.set("api-key", credentials.getLlmApiKey());
    }

    @Override
    protected String modelName() {
        return null;
    }

    @Override
    protected double inputPricePerMillion() {
        return config.getInputPricePerMillion();
    }

    @Override
    protected double outputPricePerMillion() {
        return config.getOutputPricePerMillion();
    }
}
