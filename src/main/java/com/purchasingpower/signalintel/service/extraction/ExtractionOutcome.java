package com.purchasingpower.signalintel.service.extraction;

import com.purchasingpower.signalintel.core.Candidate;

import java.util.List;

/**
 * Scored survivors of one extraction pass.
 *
 * @param candidates survivors of validation, scored, not yet deduplicated
 * @param parsed     items the model returned before any filtering
 * @param cost       model cost of the pass in USD
 */
public record ExtractionOutcome(List<Candidate> candidates, int parsed, double cost) {

    public static ExtractionOutcome empty() {
        return new ExtractionOutcome(List.of(), 0, 0.0);
    }
}
