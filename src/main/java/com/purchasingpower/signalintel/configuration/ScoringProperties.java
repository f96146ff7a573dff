package com.purchasingpower.signalintel.configuration;

import lombok.Data;

/**
 * Opportunity scoring constants. The magnitudes are heuristics; only their relative order
 * matters to callers.
 */
@Data
public class ScoringProperties {

    private int fundingRecentBase = 30;
    private int fundingStaleBase = 15;
    private int fundingRecencyDays = 90;

    private int hiringBase = 25;
    private int executiveHiringBonus = 10;

    private int acquisitionBase = 25;
    private int expansionBase = 20;
    private int execChangeBase = 15;
    private int partnershipBase = 10;
    private int certificationBase = 5;

    private int recencyBonus = 10;
    private int recencyDays = 30;

    private int placeholderPenalty = 15;

    private int lowConfidenceNewsPenalty = 20;
    private double lowConfidenceThreshold = 0.7;

    private int multiSignalBonus = 15;

    private int emailContactBonus = 20;
    private int contactBonus = 10;
}
