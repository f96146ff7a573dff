package com.purchasingpower.signalintel.service.ranking;

import com.purchasingpower.signalintel.configuration.AppProperties;
import com.purchasingpower.signalintel.configuration.ScoringProperties;
import com.purchasingpower.signalintel.core.EnrichedContact;
import com.purchasingpower.signalintel.core.IntelligenceResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final dedup and ordering of enriched results. Ranking the output again yields the same list.
 */
@Slf4j
@Component
public class ResultRanker {

    private final ScoringProperties scoring;

    public ResultRanker(AppProperties props) {
        this.scoring = props.getScoring();
    }

    public int contactBonus(EnrichedContact contact) {
        if (contact == null) {
            return 0;
        }
        return contact.hasEmail() ? scoring.getEmailContactBonus() : scoring.getContactBonus();
    }

    public int combinedScore(IntelligenceResult result) {
        return result.getCompany().getOpportunityScore() + contactBonus(result.getContact());
    }

    /**
     * One result per company (highest combined score, earlier entry on ties), sorted by
     * combined score descending.
     */
    public List<IntelligenceResult> rank(List<IntelligenceResult> results) {
        Map<String, IntelligenceResult> best = new LinkedHashMap<>();
        for (IntelligenceResult result : results) {
            best.merge(result.getCompany().dedupKey(), result,
                    (existing, incoming) -> combinedScore(incoming) > combinedScore(existing) ? incoming : existing);
        }

        List<IntelligenceResult> ranked = new ArrayList<>(best.values());
        ranked.sort(Comparator.comparingInt(this::combinedScore).reversed());
        if (ranked.size() != results.size()) {
            log.debug("Final dedup collapsed {} results to {}", results.size(), ranked.size());
        }
        return ranked;
    }
}
