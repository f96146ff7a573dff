package com.purchasingpower.signalintel.client;

import lombok.Builder;
import lombok.Value;

/**
 * Raw model output plus token usage and the cost estimated from it.
 */
@Value
@Builder
public class LLMCompletion {

    String content;

    long inputTokens;

    long outputTokens;

    /**
     * Estimated USD cost of the call.
     */
    double cost;

    public static double estimateCost(long inputTokens, long outputTokens,
                                      double inputPricePerMillion, double outputPricePerMillion) {
        return (inputTokens * inputPricePerMillion + outputTokens * outputPricePerMillion) / 1_000_000d;
    }
}
