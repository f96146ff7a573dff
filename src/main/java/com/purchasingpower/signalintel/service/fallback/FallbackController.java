package com.purchasingpower.signalintel.service.fallback;

import com.purchasingpower.signalintel.configuration.AppProperties;
import com.purchasingpower.signalintel.configuration.FallbackProperties;
import com.purchasingpower.signalintel.core.Candidate;
import com.purchasingpower.signalintel.core.Capability;
import com.purchasingpower.signalintel.core.SearchHit;
import com.purchasingpower.signalintel.exception.ProviderException;
import com.purchasingpower.signalintel.service.extraction.CompanyExtractionService;
import com.purchasingpower.signalintel.service.extraction.OpportunityScorer;
import com.purchasingpower.signalintel.service.pipeline.PipelineContext;
import com.purchasingpower.signalintel.service.planning.QueryPlan;
import com.purchasingpower.signalintel.service.search.SearchResults;
import com.purchasingpower.signalintel.service.search.SemanticSearchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * FallbackController - escalates through extraction strategies until enough candidates exist.
 *
 * Tiers run in {@link ExtractionTier} order and each one only when the previous ones
 * under-produced. A model failure counts as zero candidates for its tier; a rejected model
 * credential skips every remaining model tier. The title-derived tier needs no model, so
 * any non-empty primary search yields at least one candidate unless every hit is a
 * publication, a social platform or the caller's own domain.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FallbackController {

    private final CompanyExtractionService extractionService;
    private final SemanticSearchService searchService;
    private final TitleCandidateDeriver titleDeriver;
    private final OpportunityScorer scorer;
    private final AppProperties props;

    /**
     * @return deduplicated candidates sorted by opportunity score, highest first
     */
    public List<Candidate> run(QueryPlan plan, SearchResults primary, PipelineContext context) {
        EscalationState state = new EscalationState();

        while (!state.isFinished()) {
            ExtractionTier tier = state.getTier();
            if (shouldRun(tier, state, plan, primary, context)) {
                log.info("🪜 Extraction tier {} (survivors so far: {})", tier, state.survivorCount());
                state.absorb(tier, runTier(tier, state, primary, context), scorer);
            }
            state.advance();
        }

        log.info("✅ Escalation finished after tiers {} with {} candidates",
                state.getExecuted(), state.survivorCount());
        return state.getSurvivors();
    }

    private boolean shouldRun(ExtractionTier tier, EscalationState state, QueryPlan plan,
                              SearchResults primary, PipelineContext context) {
        FallbackProperties config = props.getFallback();
        return switch (tier) {
            case MODEL_PRIMARY -> !primary.isEmpty() && context.isEnabled(Capability.LANGUAGE_MODEL);
            case MODEL_LITERAL_RESEARCH -> plan.descriptive()
                    && state.survivorCount() < config.getMinResults()
                    && context.isEnabled(Capability.LANGUAGE_MODEL);
            case TITLE_DERIVED -> !primary.isEmpty()
                    && state.survivorCount() < config.getTitleFallbackThreshold();
        };
    }

    private List<Candidate> runTier(ExtractionTier tier, EscalationState state,
                                    SearchResults primary, PipelineContext context) {
        return switch (tier) {
            case MODEL_PRIMARY -> extractSafely(primary.hits(), context);
            case MODEL_LITERAL_RESEARCH -> literalResearch(context);
            case TITLE_DERIVED -> deriveFromTitles(state, primary, context);
        };
    }

    /**
     * Title-derived candidates for companies not already found by a model tier.
     */
    private List<Candidate> deriveFromTitles(EscalationState state, SearchResults primary, PipelineContext context) {
        Set<String> known = new HashSet<>();
        state.getPool().forEach(candidate -> known.add(candidate.dedupKey()));

        return titleDeriver.derive(primary.hits(), context.getExcludedDomain()).stream()
                .filter(candidate -> !known.contains(candidate.dedupKey()))
                .limit(props.getFallback().getMaxTitleCandidates())
                .toList();
    }

    private List<Candidate> literalResearch(PipelineContext context) {
        SearchResults research;
        try {
            research = searchService.searchLiteral(context.getQuery(), context);
        } catch (ProviderException e) {
            log.warn("⚠️ Literal re-search failed: {}", e.getMessage());
            return List.of();
        }
        return extractSafely(research.hits(), context);
    }

    private List<Candidate> extractSafely(List<SearchHit> hits, PipelineContext context) {
        if (hits.isEmpty()) {
            return List.of();
        }
        try {
            return extractionService.extract(hits, context).candidates();
        } catch (ProviderException e) {
            if (e.isRejected()) {
                context.markRejected(Capability.LANGUAGE_MODEL);
            }
            log.warn("⚠️ Model extraction failed, tier yields nothing: {}", e.getMessage());
            return List.of();
        }
    }
}
