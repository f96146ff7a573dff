package com.purchasingpower.signalintel.client;

import com.purchasingpower.signalintel.core.ProviderType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the language-model backend chosen for a request.
 */
@Slf4j
@Component
public class LLMProviderFactory {

    private final Map<ProviderType, LLMProvider> providers = new EnumMap<>(ProviderType.class);

    public LLMProviderFactory(List<LLMProvider> available) {
        for (LLMProvider provider : available) {
            providers.put(provider.getProviderType(), provider);
        }
        log.info("🤖 LLM backends available: {}", providers.keySet());
    }

    public LLMProvider getProvider(ProviderType type) {
        LLMProvider provider = providers.get(type);
        if (provider == null) {
            throw new IllegalStateException("No LLM backend registered for " + type);
        }
        return provider;
    }
}
