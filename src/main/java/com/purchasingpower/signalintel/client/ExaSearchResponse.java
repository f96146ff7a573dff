package com.purchasingpower.signalintel.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Wire shape of an Exa {@code /search} response. Only the fields the pipeline reads are mapped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExaSearchResponse(String requestId, List<Result> results, CostDollars costDollars) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Result(String id, String url, String title, String publishedDate,
                         String author, Double score, String text) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CostDollars(Double total) {
    }
}
