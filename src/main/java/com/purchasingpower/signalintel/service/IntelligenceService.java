package com.purchasingpower.signalintel.service;

import com.google.common.base.Stopwatch;
import com.purchasingpower.signalintel.api.IntelligenceRequest;
import com.purchasingpower.signalintel.api.IntelligenceResponse;
import com.purchasingpower.signalintel.api.IntelligenceResponse.Costs;
import com.purchasingpower.signalintel.api.IntelligenceResponse.MarketActivity;
import com.purchasingpower.signalintel.api.IntelligenceResponse.Meta;
import com.purchasingpower.signalintel.configuration.AppProperties;
import com.purchasingpower.signalintel.core.Candidate;
import com.purchasingpower.signalintel.core.IntelligenceResult;
import com.purchasingpower.signalintel.core.ProviderType;
import com.purchasingpower.signalintel.core.RequestCredentials;
import com.purchasingpower.signalintel.exception.PreconditionFailedException;
import com.purchasingpower.signalintel.service.cache.CachedRun;
import com.purchasingpower.signalintel.service.cache.ResultCache;
import com.purchasingpower.signalintel.service.enrichment.ContactEnrichmentService;
import com.purchasingpower.signalintel.service.fallback.FallbackController;
import com.purchasingpower.signalintel.service.pipeline.CostLedger;
import com.purchasingpower.signalintel.service.pipeline.PipelineContext;
import com.purchasingpower.signalintel.service.planning.QueryPlan;
import com.purchasingpower.signalintel.service.planning.QueryPlanner;
import com.purchasingpower.signalintel.service.ranking.ResultRanker;
import com.purchasingpower.signalintel.service.search.SearchResults;
import com.purchasingpower.signalintel.service.search.SemanticSearchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * IntelligenceService - runs one signal search end to end.
 *
 * Stages, each feeding the next:
 * 1. cache lookup
 * 2. query planning
 * 3. semantic search
 * 4. extraction with fallback escalation
 * 5. contact enrichment
 * 6. final ranking, then cache write
 *
 * Precondition failures are thrown before any external call. Every other failure is
 * turned into an unsuccessful response here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntelligenceService {

    static final int MIN_QUERY_LENGTH = 3;

    private final ResultCache resultCache;
    private final QueryPlanner queryPlanner;
    private final SemanticSearchService searchService;
    private final FallbackController fallbackController;
    private final ContactEnrichmentService enrichmentService;
    private final ResultRanker resultRanker;
    private final AppProperties props;

    /**
     * @throws PreconditionFailedException when the request cannot be served as sent
     */
    public IntelligenceResponse execute(IntelligenceRequest request, RequestCredentials credentials) {
        checkNotNull(request, "request");
        checkNotNull(credentials, "credentials");
        Stopwatch stopwatch = Stopwatch.createStarted();

        validate(request, credentials);
        String query = request.getQuery().trim();
        String excludedDomain = blankToNull(request.getExcludedDomain());
        boolean includeContacts = request.includeContactsOrDefault();

        try {
            Optional<List<IntelligenceResult>> cached = resultCache.lookup(query, excludedDomain, includeContacts);
            if (cached.isPresent()) {
                return respond(query, cached.get(), true, Costs.of(0, 0, 0), stopwatch);
            }

            PipelineContext context = new PipelineContext(query, excludedDomain, credentials);
            log.info("🚀 Signal search: \"{}\" (exclude={}, contacts={}, provider={})",
                    query, excludedDomain, includeContacts, credentials.getLlmProvider().getTag());

            QueryPlan plan = queryPlanner.plan(context);
            SearchResults primary = searchService.search(plan, context);
            if (primary.isEmpty()) {
                log.info("🔎 Search found nothing for \"{}\"", query);
                return respond(query, List.of(), false, costsOf(context.getCosts()), stopwatch);
            }

            List<Candidate> candidates = fallbackController.run(plan, primary, context);
            int effectiveCount = plan.descriptive()
                    ? Math.max(request.resultCountOrDefault(), props.getFallback().getDescriptiveMinResults())
                    : request.resultCountOrDefault();
            List<Candidate> selected = candidates.size() > effectiveCount
                    ? candidates.subList(0, effectiveCount)
                    : candidates;

            List<IntelligenceResult> enriched = enrichmentService.enrichAll(selected, context, includeContacts);
            List<IntelligenceResult> ranked = resultRanker.rank(enriched);

            CostLedger costs = context.getCosts();
            resultCache.store(CachedRun.builder()
                    .query(query)
                    .excludedDomain(excludedDomain)
                    .results(ranked)
                    .searchRequestId(primary.requestId())
                    .searchCost(costs.getSearch())
                    .modelCost(costs.getModel())
                    .enrichmentCost(costs.getEnrichment())
                    .latencyMs(stopwatch.elapsed(TimeUnit.MILLISECONDS))
                    .build());

            return respond(query, ranked, false, costsOf(costs), stopwatch);

        } catch (RuntimeException e) {
            log.error("❌ Signal search failed for \"{}\"", query, e);
            return IntelligenceResponse.failure(
                    e.getMessage() != null ? e.getMessage() : "Internal error",
                    query,
                    stopwatch.elapsed(TimeUnit.MILLISECONDS));
        }
    }

    void validate(IntelligenceRequest request, RequestCredentials credentials) {
        String query = request.getQuery();
        if (query == null || query.trim().length() < MIN_QUERY_LENGTH) {
            throw new PreconditionFailedException("Query must be at least " + MIN_QUERY_LENGTH + " characters");
        }
        if (request.getResultCount() != null && request.getResultCount() < 1) {
            throw new PreconditionFailedException("resultCount must be at least 1");
        }
        if (isBlank(credentials.getSearchApiKey())) {
            throw new PreconditionFailedException("Exa API key required (x-exa-key header)");
        }

        ProviderType provider = credentials.getLlmProvider();
        if (isBlank(credentials.getLlmApiKey())) {
            throw new PreconditionFailedException(switch (provider) {
                case OPENAI -> "OpenAI API key required (x-openai-key header)";
                case AZURE -> "Azure OpenAI API key required (x-azure-key header)";
                case ANTHROPIC -> "Anthropic API key required (x-anthropic-key header)";
            });
        }
        if (provider == ProviderType.AZURE
                && (isBlank(credentials.getLlmEndpoint()) || isBlank(credentials.getLlmDeployment()))) {
            throw new PreconditionFailedException(
                    "Azure OpenAI requires an endpoint and deployment (x-azure-endpoint, x-azure-deployment headers)");
        }
    }

    private IntelligenceResponse respond(String query, List<IntelligenceResult> results, boolean cached,
                                         Costs costs, Stopwatch stopwatch) {
        long latencyMs = stopwatch.elapsed(TimeUnit.MILLISECONDS);
        log.info("✅ Signal search complete: {} results in {}ms{}", results.size(), latencyMs, cached ? " (cached)" : "");
        return IntelligenceResponse.success(results, Meta.builder()
                .query(query)
                .resultCount(results.size())
                .latencyMs(latencyMs)
                .cached(cached)
                .costs(costs)
                .marketActivity(MarketActivity.of(results))
                .build());
    }

    private static Costs costsOf(CostLedger ledger) {
        return Costs.of(ledger.getSearch(), ledger.getModel(), ledger.getEnrichment());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }
}
