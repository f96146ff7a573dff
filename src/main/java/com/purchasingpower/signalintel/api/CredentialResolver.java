package com.purchasingpower.signalintel.api;

import com.purchasingpower.signalintel.configuration.AppProperties;
import com.purchasingpower.signalintel.configuration.CredentialProperties;
import com.purchasingpower.signalintel.core.ProviderType;
import com.purchasingpower.signalintel.core.RequestCredentials;
import com.purchasingpower.signalintel.exception.PreconditionFailedException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds request credentials from headers, falling back to configured defaults per value.
 */
@Component
@RequiredArgsConstructor
public class CredentialResolver {

    private final AppProperties props;

    /**
     * Raw header values as sent by the caller; any of them may be {@code null}.
     */
    public record CredentialHeaders(String searchKey, String providerTag, String openaiKey, String azureKey,
                                    String azureEndpoint, String azureDeployment, String anthropicKey,
                                    String enrichmentKey) {
    }

    public RequestCredentials resolve(CredentialHeaders headers) {
        CredentialProperties defaults = props.getCredentials();
        ProviderType provider = ProviderType.fromTag(headers.providerTag())
                .orElseThrow(() -> new PreconditionFailedException(
                        "Unknown AI provider '" + headers.providerTag() + "'. Use openai, azure or anthropic."));

        String modelKey = switch (provider) {
            case OPENAI -> firstPresent(headers.openaiKey(), defaults.getOpenaiApiKey());
            case AZURE -> firstPresent(headers.azureKey(), defaults.getAzureApiKey());
            case ANTHROPIC -> firstPresent(headers.anthropicKey(), defaults.getAnthropicApiKey());
        };

        RequestCredentials.RequestCredentialsBuilder builder = RequestCredentials.builder()
                .searchApiKey(firstPresent(headers.searchKey(), defaults.getExaApiKey()))
                .llmProvider(provider)
                .llmApiKey(modelKey)
                .enrichmentApiKey(firstPresent(headers.enrichmentKey(), defaults.getApolloApiKey()));

        if (provider == ProviderType.AZURE) {
            builder.llmEndpoint(firstPresent(headers.azureEndpoint(), defaults.getAzureEndpoint()))
                    .llmDeployment(firstPresent(headers.azureDeployment(), defaults.getAzureDeployment()));
        }
        return builder.build();
    }

    private static String firstPresent(String header, String fallback) {
        if (header != null && !header.isBlank()) {
            return header.trim();
        }
        return fallback != null && !fallback.isBlank() ? fallback.trim() : null;
    }
}
