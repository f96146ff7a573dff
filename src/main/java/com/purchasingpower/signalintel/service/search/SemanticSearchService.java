package com.purchasingpower.signalintel.service.search;

import com.purchasingpower.signalintel.client.ExaSearchClient;
import com.purchasingpower.signalintel.client.ExaSearchClient.SearchBatch;
import com.purchasingpower.signalintel.config.ExecutorConfig;
import com.purchasingpower.signalintel.configuration.AppProperties;
import com.purchasingpower.signalintel.core.SearchHit;
import com.purchasingpower.signalintel.exception.ProviderException;
import com.purchasingpower.signalintel.model.ServiceType;
import com.purchasingpower.signalintel.service.pipeline.PipelineContext;
import com.purchasingpower.signalintel.service.planning.QueryPlan;
import com.purchasingpower.signalintel.util.DomainUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs the planned searches and merges their hits.
 *
 * <p>Generated queries run concurrently on the intelligence executor and are all joined
 * before returning. A single failing sub-query only loses its own hits; the stage fails
 * only when every sub-query failed.
 *
 * <p>Merged results keep one hit per domain (the most relevant one). A literal search keeps
 * every hit, since several articles about one company can carry different signals.
 */
@Slf4j
@Service
public class SemanticSearchService {

    private final ExaSearchClient searchClient;
    private final Executor executor;
    private final AppProperties props;

    public SemanticSearchService(ExaSearchClient searchClient,
                                 @Qualifier(ExecutorConfig.INTELLIGENCE_EXECUTOR) Executor executor,
                                 AppProperties props) {
        this.searchClient = searchClient;
        this.executor = executor;
        this.props = props;
    }

    public SearchResults search(QueryPlan plan, PipelineContext context) {
        if (!plan.descriptive()) {
            return searchLiteral(plan.queries().get(0), context);
        }
        return searchParallel(plan.queries(), context);
    }

    /**
     * One search for the text as typed, {@code app.search.literal-results} hits.
     */
    public SearchResults searchLiteral(String query, PipelineContext context) {
        SearchBatch batch = searchClient.search(query, props.getSearch().getLiteralResults(),
                context.getCredentials().getSearchApiKey());
        context.getCosts().addSearch(batch.cost());

        List<SearchHit> hits = batch.hits().stream()
                .filter(SemanticSearchService::hasUsableDomain)
                .toList();
        log.info("🔎 Literal search returned {} hits ({} usable)", batch.hits().size(), hits.size());
        return new SearchResults(hits, batch.requestId());
    }

    /**
     * All queries concurrently, merged and reduced to the most relevant hit per domain.
     */
    public SearchResults searchParallel(List<String> queries, PipelineContext context) {
        int perQuery = props.getSearch().getResultsPerQuery();
        String apiKey = context.getCredentials().getSearchApiKey();

        List<CompletableFuture<SearchBatch>> futures = queries.stream()
                .map(query -> CompletableFuture
                        .supplyAsync(() -> searchClient.search(query, perQuery, apiKey), executor)
                        .exceptionally(ex -> {
                            log.warn("⚠️ Sub-query failed, continuing without it: \"{}\" ({})",
                                    query, unwrap(ex).getMessage());
                            return null;
                        }))
                .toList();

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<SearchBatch> batches = futures.stream()
                .map(CompletableFuture::join)
                .filter(Objects::nonNull)
                .toList();

        if (batches.isEmpty()) {
            throw new ProviderException(ServiceType.EXA, "all " + queries.size() + " search queries failed", null);
        }

        List<SearchHit> all = new ArrayList<>();
        String requestId = null;
        for (SearchBatch batch : batches) {
            context.getCosts().addSearch(batch.cost());
            all.addAll(batch.hits());
            if (requestId == null) {
                requestId = batch.requestId();
            }
        }

        List<SearchHit> merged = dedupeByDomain(all, props.getSearch().getMaxMergedHits());
        log.info("🔎 {} queries returned {} hits, {} after domain dedup", batches.size(), all.size(), merged.size());
        return new SearchResults(merged, requestId);
    }

    /**
     * Keeps the most relevant hit per domain, ordered by relevance, at most {@code limit}.
     */
    static List<SearchHit> dedupeByDomain(List<SearchHit> hits, int limit) {
        Map<String, SearchHit> byDomain = new LinkedHashMap<>();
        for (SearchHit hit : hits) {
            if (!hasUsableDomain(hit)) {
                continue;
            }
            byDomain.merge(DomainUtils.extractDomain(hit.getUrl()), hit,
                    (existing, candidate) -> candidate.getRelevanceScore() > existing.getRelevanceScore()
                            ? candidate
                            : existing);
        }
        return byDomain.values().stream()
                .sorted(Comparator.comparingDouble(SearchHit::getRelevanceScore).reversed())
                .limit(limit)
                .toList();
    }

    private static boolean hasUsableDomain(SearchHit hit) {
        String domain = DomainUtils.extractDomain(hit.getUrl());
        return domain != null && !DomainUtils.isSocialPlatform(domain);
    }

    private static Throwable unwrap(Throwable ex) {
        return ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
    }
}
