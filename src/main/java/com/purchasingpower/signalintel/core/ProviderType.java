package com.purchasingpower.signalintel.core;

import java.util.Locale;
import java.util.Optional;

/**
 * Language-model backends selectable per request via the {@code x-ai-provider} tag.
 *
 * @since 1.0.0
 */
public enum ProviderType {
    OPENAI("openai"),
    AZURE("azure"),
    ANTHROPIC("anthropic");

    private final String tag;

    ProviderType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static Optional<ProviderType> fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return Optional.of(OPENAI);
        }
        String lower = tag.trim().toLowerCase(Locale.ROOT);
        for (ProviderType type : values()) {
            if (type.tag.equals(lower)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
