package com.purchasingpower.signalintel.client;

import com.purchasingpower.signalintel.core.ProviderType;
import com.purchasingpower.signalintel.core.RequestCredentials;

/**
 * Unified interface for language-model backends (OpenAI, Azure OpenAI, Anthropic).
 *
 * Prompts are built by the caller and are identical for every backend; implementations
 * only differ in endpoint, authentication and response envelope.
 *
 * @since 1.0.0
 */
public interface LLMProvider {

    /**
     * Execute one completion.
     *
     * @param request     prompts and sampling options
     * @param credentials request-scoped credentials carrying this backend's key
     * @return raw model text plus token usage and estimated cost
     * @throws com.purchasingpower.signalintel.exception.ProviderException on any upstream failure
     */
    LLMCompletion complete(LLMRequest request, RequestCredentials credentials);

    ProviderType getProviderType();

    /**
     * Get the provider name (for logging).
     */
    String getProviderName();
}
