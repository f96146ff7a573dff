package com.purchasingpower.signalintel.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.signalintel.core.IntelligenceResult;
import com.purchasingpower.signalintel.core.SignalType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Signal search response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IntelligenceResponse {

    private boolean success;
    private String error;

    @Builder.Default
    private List<IntelligenceResult> results = new ArrayList<>();

    private Meta meta;

    public static IntelligenceResponse success(List<IntelligenceResult> results, Meta meta) {
        return IntelligenceResponse.builder()
            .success(true)
            .results(results)
            .meta(meta)
            .build();
    }

    public static IntelligenceResponse failure(String error, String query, long latencyMs) {
        return IntelligenceResponse.builder()
            .success(false)
            .error(error)
            .meta(Meta.builder()
                .query(query != null ? query : "")
                .latencyMs(latencyMs)
                .costs(Costs.builder().build())
                .build())
            .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Meta {
        private String query;
        private int resultCount;
        private long latencyMs;
        private boolean cached;
        private Costs costs;
        private MarketActivity marketActivity;
    }

    /**
     * Estimated USD spend per provider category.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Costs {
        private double search;
        private double model;
        private double enrichment;
        private double total;

        public static Costs of(double search, double model, double enrichment) {
            return new Costs(search, model, enrichment, search + model + enrichment);
        }
    }

    /**
     * Signal counts over the returned results.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MarketActivity {
        private int hiring;
        private int funding;
        private int expansion;
        private int acquisition;
        @JsonProperty("exec_change")
        private int execChange;

        public static MarketActivity of(List<IntelligenceResult> results) {
            MarketActivity activity = new MarketActivity();
            for (IntelligenceResult result : results) {
                SignalType type = result.getCompany().getSignalType();
                if (type == null) {
                    continue;
                }
                switch (type) {
                    case HIRING -> activity.hiring++;
                    case FUNDING -> activity.funding++;
                    case EXPANSION -> activity.expansion++;
                    case ACQUISITION -> activity.acquisition++;
                    case EXEC_CHANGE -> activity.execChange++;
                    default -> {
                    }
                }
            }
            return activity;
        }
    }
}
