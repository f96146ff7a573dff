package com.purchasingpower.signalintel.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class FallbackProperties {

    /**
     * Word count at which a query is treated as a description rather than a literal search.
     */
    @Min(1)
    private int descriptiveWordThreshold = 5;

    /**
     * Below this many survivors a descriptive query escalates to the literal re-search tier.
     */
    @Min(0)
    private int minResults = 3;

    /**
     * Below this many survivors title-derived candidates are merged in.
     */
    @Min(0)
    private int titleFallbackThreshold = 5;

    @Min(1)
    private int maxTitleCandidates = 15;

    @Min(1)
    private int maxGeneratedQueries = 5;

    /**
     * Descriptive queries return at least this many results regardless of the requested count.
     */
    @Min(1)
    private int descriptiveMinResults = 15;
}
