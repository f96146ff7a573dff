package com.purchasingpower.signalintel.core;

import lombok.Builder;
import lombok.Value;

/**
 * Capability credentials for one request, resolved from headers with configured fallbacks.
 */
@Value
@Builder(toBuilder = true)
public class RequestCredentials {

    String searchApiKey;

    ProviderType llmProvider;

    String llmApiKey;

    /**
     * Azure resource endpoint, e.g. {@code https://acme.openai.azure.com}. Azure only.
     */
    String llmEndpoint;

    /**
     * Azure deployment name. Azure only.
     */
    String llmDeployment;

    String enrichmentApiKey;

    public boolean hasEnrichmentKey() {
        return enrichmentApiKey != null && !enrichmentApiKey.isBlank();
    }
}
