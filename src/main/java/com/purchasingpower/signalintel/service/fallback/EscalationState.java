package com.purchasingpower.signalintel.service.fallback;

import com.purchasingpower.signalintel.core.Candidate;
import com.purchasingpower.signalintel.service.extraction.OpportunityScorer;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Progress of one escalation run: the tier to evaluate next, every scored candidate seen so
 * far and the deduplicated survivors derived from them.
 */
@Getter
public class EscalationState {

    private ExtractionTier tier = ExtractionTier.MODEL_PRIMARY;

    private final List<Candidate> pool = new ArrayList<>();

    private List<Candidate> survivors = List.of();

    private final Set<ExtractionTier> executed = EnumSet.noneOf(ExtractionTier.class);

    /**
     * Adds a tier's candidates, re-scores the whole pool so multi-signal bonuses span tiers,
     * and recomputes survivors.
     */
    void absorb(ExtractionTier source, List<Candidate> candidates, OpportunityScorer scorer) {
        executed.add(source);
        pool.addAll(candidates);
        scorer.scoreAll(pool);
        survivors = OpportunityScorer.dedupHighest(pool);
    }

    void advance() {
        tier = tier == null ? null : tier.next();
    }

    public boolean isFinished() {
        return tier == null;
    }

    public int survivorCount() {
        return survivors.size();
    }

    public Set<ExtractionTier> getExecuted() {
        return Collections.unmodifiableSet(executed);
    }
}
