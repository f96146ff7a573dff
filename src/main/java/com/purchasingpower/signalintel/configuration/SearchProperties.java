package com.purchasingpower.signalintel.configuration;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class SearchProperties {

    @NotBlank
    private String baseUrl = "https://api.exa.ai";

    /**
     * Results requested per generated sub-query in descriptive mode.
     */
    @Min(1)
    @Max(100)
    private int resultsPerQuery = 15;

    /**
     * Results requested by a single literal search (direct mode and the tier-2 re-search).
     */
    @Min(1)
    @Max(100)
    private int literalResults = 25;

    @Min(1)
    private int maxMergedHits = 30;
}
