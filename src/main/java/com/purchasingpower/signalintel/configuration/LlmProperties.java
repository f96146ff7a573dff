package com.purchasingpower.signalintel.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Model names, endpoints and pricing per backend. Prices are USD per million tokens and
 * only feed the cost estimate returned to the caller.
 */
@Data
public class LlmProperties {

    private double plannerTemperature = 0.7;

    private double extractionTemperature = 0.1;

    @Valid
    private OpenAi openai = new OpenAi();

    @Valid
    private Azure azure = new Azure();

    @Valid
    private Anthropic anthropic = new Anthropic();

    @Data
    public static class OpenAi {
        @NotBlank
        private String baseUrl = "https://api.openai.com";
        @NotBlank
        private String chatModel = "gpt-4o-mini";
        private double inputPricePerMillion = 0.15;
        private double outputPricePerMillion = 0.60;
    }

    @Data
    public static class Azure {
        @NotBlank
        private String apiVersion = "2024-02-15-preview";
        private double inputPricePerMillion = 0.15;
        private double outputPricePerMillion = 0.60;
    }

    @Data
    public static class Anthropic {
        @NotBlank
        private String baseUrl = "https://api.anthropic.com";
        @NotBlank
        private String chatModel = "claude-3-haiku-20240307";
        @NotBlank
        private String apiVersion = "2023-06-01";
        private int maxTokens = 4096;
        private double inputPricePerMillion = 0.25;
        private double outputPricePerMillion = 1.25;
    }
}
