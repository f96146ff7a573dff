package com.purchasingpower.signalintel.service.extraction;

import com.purchasingpower.signalintel.configuration.AppProperties;
import com.purchasingpower.signalintel.configuration.ScoringProperties;
import com.purchasingpower.signalintel.core.Candidate;
import com.purchasingpower.signalintel.core.SignalType;
import com.purchasingpower.signalintel.core.SourceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Opportunity intensity scoring.
 *
 * <p>Scores reflect how timely and actionable a signal is. Every candidate is scored before
 * any dedup so that the multi-signal bonus can see all signals of a company.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class OpportunityScorer {

    public static final String PLACEHOLDER_HEADLINE = "Signal detected";

    private static final Pattern EXECUTIVE_TITLE = Pattern.compile(
            "\\b(cfo|cro|cto|cmo|coo|vp|vice president|head of|chief|director|svp|evp)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Map<SignalType, String> REASONS = new EnumMap<>(Map.of(
            SignalType.HIRING, "Actively building team",
            SignalType.FUNDING, "Fresh budget available",
            SignalType.EXPANSION, "Entering new markets",
            SignalType.EXEC_CHANGE, "Leadership transition",
            SignalType.ACQUISITION, "Acquisition activity",
            SignalType.PARTNERSHIP, "New partnership forming",
            SignalType.CERTIFICATION, "Compliance milestone"));

    private final ScoringProperties scoring;
    private final Clock clock;

    public OpportunityScorer(AppProperties props, Clock clock) {
        this.scoring = props.getScoring();
        this.clock = clock;
    }

    /**
     * Score of a single candidate in isolation, never negative.
     */
    public int computeOpportunityScore(Candidate candidate) {
        LocalDate today = LocalDate.now(clock);
        Long ageDays = candidate.getSignalDate() == null
                ? null
                : ChronoUnit.DAYS.between(candidate.getSignalDate(), today);

        int score = baseScore(candidate, ageDays);

        if (ageDays != null && ageDays <= scoring.getRecencyDays()) {
            score += scoring.getRecencyBonus();
        }

        String headline = candidate.getSignalHeadline();
        if (headline == null || headline.isBlank() || PLACEHOLDER_HEADLINE.equalsIgnoreCase(headline.trim())) {
            score -= scoring.getPlaceholderPenalty();
        }

        if (candidate.getSourceType() == SourceType.NEWS
                && candidate.getConfidence() < scoring.getLowConfidenceThreshold()) {
            score -= scoring.getLowConfidenceNewsPenalty();
        }

        return Math.max(0, score);
    }

    private int baseScore(Candidate candidate, Long ageDays) {
        SignalType type = candidate.getSignalType() == null ? SignalType.OTHER : candidate.getSignalType();
        return switch (type) {
            case FUNDING -> ageDays != null && ageDays <= scoring.getFundingRecencyDays()
                    ? scoring.getFundingRecentBase()
                    : scoring.getFundingStaleBase();
            case HIRING -> scoring.getHiringBase() + (namesExecutive(candidate.getSignalHeadline())
                    ? scoring.getExecutiveHiringBonus()
                    : 0);
            case ACQUISITION -> scoring.getAcquisitionBase();
            case EXPANSION -> scoring.getExpansionBase();
            case EXEC_CHANGE -> scoring.getExecChangeBase();
            case PARTNERSHIP -> scoring.getPartnershipBase();
            case CERTIFICATION -> scoring.getCertificationBase();
            case OTHER -> 0;
        };
    }

    static boolean namesExecutive(String headline) {
        return headline != null && EXECUTIVE_TITLE.matcher(headline).find();
    }

    /**
     * Short sales-facing phrase for a signal type, or {@code null} for {@code other}.
     */
    public static String reasonFor(SignalType type) {
        return type == null ? null : REASONS.get(type);
    }

    /**
     * Sets score and reason on every candidate, then applies the multi-signal bonus across
     * the batch. Candidates are mutated in place.
     */
    public void scoreAll(Collection<Candidate> candidates) {
        for (Candidate candidate : candidates) {
            candidate.setOpportunityScore(computeOpportunityScore(candidate));
            candidate.setOpportunityReason(reasonFor(candidate.getSignalType()));
        }
        applyMultiSignalBonus(candidates);
    }

    /**
     * Adds the bonus to every entry of a company that shows two or more distinct signal types.
     */
    public void applyMultiSignalBonus(Collection<Candidate> candidates) {
        Map<String, Set<SignalType>> signalsByKey = new HashMap<>();
        for (Candidate candidate : candidates) {
            signalsByKey.computeIfAbsent(candidate.dedupKey(), k -> new HashSet<>()).add(candidate.getSignalType());
        }
        for (Candidate candidate : candidates) {
            if (signalsByKey.get(candidate.dedupKey()).size() >= 2) {
                candidate.setOpportunityScore(candidate.getOpportunityScore() + scoring.getMultiSignalBonus());
            }
        }
    }

    /**
     * One candidate per company, the highest-scoring one, in descending score order.
     * Ties keep the earlier entry.
     */
    public static List<Candidate> dedupHighest(Collection<Candidate> candidates) {
        Map<String, Candidate> best = new LinkedHashMap<>();
        for (Candidate candidate : candidates) {
            best.merge(candidate.dedupKey(), candidate,
                    (existing, incoming) -> incoming.getOpportunityScore() > existing.getOpportunityScore()
                            ? incoming
                            : existing);
        }
        List<Candidate> result = new ArrayList<>(best.values());
        result.sort(Comparator.comparingInt(Candidate::getOpportunityScore).reversed());
        return result;
    }
}
