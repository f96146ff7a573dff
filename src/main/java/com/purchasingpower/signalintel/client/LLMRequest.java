package com.purchasingpower.signalintel.client;

import lombok.Builder;
import lombok.Value;

/**
 * Backend-agnostic completion request.
 */
@Value
@Builder
public class LLMRequest {

    /**
     * Optional system instruction; omitted from the call when {@code null}.
     */
    String systemPrompt;

    String userPrompt;

    @Builder.Default
    double temperature = 0.1;

    /**
     * Ask the backend for a JSON object response where it supports that natively.
     */
    boolean jsonMode;

    /**
     * Output token cap; {@code null} leaves the backend default (Anthropic requires one and
     * falls back to {@code app.llm.anthropic.max-tokens}).
     */
    Integer maxTokens;

    /**
     * Label used in logs, e.g. "query-planner".
     */
    @Builder.Default
    String purpose = "completion";
}
