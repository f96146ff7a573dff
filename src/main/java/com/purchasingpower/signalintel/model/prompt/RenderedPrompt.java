package com.purchasingpower.signalintel.model.prompt;

/**
 * A template after variable substitution. {@code systemPrompt} is {@code null} when the
 * template defines none.
 */
public record RenderedPrompt(String name, String systemPrompt, String userPrompt,
                             double temperature, boolean jsonMode) {
}
