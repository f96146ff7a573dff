package com.purchasingpower.signalintel.configuration;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class EnrichmentProperties {

    @NotBlank
    private String baseUrl = "https://api.apollo.io";

    /**
     * Estimated USD per candidate looked up.
     */
    private double costPerLookup = 0.01;

    /**
     * How many of the top title tiers are retried by company name when the domain search misses.
     */
    @Min(0)
    @Max(4)
    private int nameFallbackTiers = 2;
}
