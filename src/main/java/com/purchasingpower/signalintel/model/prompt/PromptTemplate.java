package com.purchasingpower.signalintel.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Prompt template loaded from YAML configuration.
 *
 * YAML structure:
 * <pre>
 * name: company-extraction
 * version: 1.0
 * temperature: 0.1
 * jsonMode: true
 * systemPrompt: |
 *   You extract structured company data...
 * userPrompt: |
 *   Search results: {{{context}}}
 * </pre>
 *
 * Prompts are backend-agnostic; the same template is sent to every language-model provider.
 *
 * @see com.purchasingpower.signalintel.service.PromptLibraryService
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {
    private String name;
    private String version;
    private double temperature;
    private boolean jsonMode;
    private String systemPrompt;
    private String userPrompt;
}
