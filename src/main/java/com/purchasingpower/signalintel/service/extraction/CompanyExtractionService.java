package com.purchasingpower.signalintel.service.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.signalintel.client.LLMCompletion;
import com.purchasingpower.signalintel.client.LLMProvider;
import com.purchasingpower.signalintel.client.LLMProviderFactory;
import com.purchasingpower.signalintel.client.LLMRequest;
import com.purchasingpower.signalintel.configuration.AppProperties;
import com.purchasingpower.signalintel.configuration.ExtractionProperties;
import com.purchasingpower.signalintel.core.Candidate;
import com.purchasingpower.signalintel.core.SearchHit;
import com.purchasingpower.signalintel.core.SignalType;
import com.purchasingpower.signalintel.core.SourceType;
import com.purchasingpower.signalintel.model.prompt.RenderedPrompt;
import com.purchasingpower.signalintel.service.PromptLibraryService;
import com.purchasingpower.signalintel.service.pipeline.PipelineContext;
import com.purchasingpower.signalintel.util.DomainUtils;
import com.purchasingpower.signalintel.util.LlmJson;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CompanyExtractionService - turns search hits into validated, scored candidates.
 *
 * The model proposes companies and signals for each hit. Its output is treated as a hint:
 * - every item must point at a real hit index
 * - the company domain is recomputed from that hit's URL
 * - publications, the caller's own company and name/domain mismatches are dropped
 *
 * Provider failures propagate as {@link com.purchasingpower.signalintel.exception.ProviderException};
 * malformed model output yields zero candidates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompanyExtractionService {

    static final String PROMPT_NAME = "company-extraction";

    private final LLMProviderFactory providerFactory;
    private final PromptLibraryService promptLibrary;
    private final OpportunityScorer scorer;
    private final ObjectMapper objectMapper;
    private final AppProperties props;

    public ExtractionOutcome extract(List<SearchHit> hits, PipelineContext context) {
        if (hits.isEmpty()) {
            return ExtractionOutcome.empty();
        }

        ExtractionProperties config = props.getExtraction();
        List<SearchHit> batch = hits.size() > config.getMaxContextHits()
                ? hits.subList(0, config.getMaxContextHits())
                : hits;

        RenderedPrompt prompt = promptLibrary.render(PROMPT_NAME, promptVariables(batch, context.getExcludedDomain()));
        LLMProvider provider = providerFactory.getProvider(context.getCredentials().getLlmProvider());
        log.info("🤖 Extracting companies from {} hits via {}", batch.size(), provider.getProviderName());

        LLMCompletion completion = provider.complete(LLMRequest.builder()
                .systemPrompt(prompt.systemPrompt())
                .userPrompt(prompt.userPrompt())
                .temperature(props.getLlm().getExtractionTemperature())
                .jsonMode(prompt.jsonMode())
                .purpose(PROMPT_NAME)
                .build(), context.getCredentials());
        context.getCosts().addModel(completion.getCost());

        List<ExtractedCompanyPayload> items = parseCompanies(completion.getContent());
        List<Candidate> survivors = new ArrayList<>();
        for (ExtractedCompanyPayload item : items) {
            Candidate candidate = validate(item, batch, context.getExcludedDomain());
            if (candidate != null) {
                survivors.add(candidate);
            }
        }

        scorer.scoreAll(survivors);
        log.info("📋 Extraction: {} items parsed, {} survived validation", items.size(), survivors.size());
        return new ExtractionOutcome(survivors, items.size(), completion.getCost());
    }

    private Map<String, Object> promptVariables(List<SearchHit> batch, String excludedDomain) {
        int maxChars = props.getExtraction().getMaxTextChars();
        List<Map<String, Object>> context = new ArrayList<>();
        for (int i = 0; i < batch.size(); i++) {
            SearchHit hit = batch.get(i);
            String text = hit.getSnippetText();
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("index", i);
            entry.put("url", hit.getUrl());
            entry.put("title", hit.getTitle());
            entry.put("text", text != null && text.length() > maxChars ? text.substring(0, maxChars) : text);
            entry.put("publishedDate", hit.getPublishedAt() != null ? hit.getPublishedAt().toString() : null);
            entry.put("score", hit.getRelevanceScore());
            context.add(entry);
        }

        Map<String, Object> variables = new HashMap<>();
        try {
            variables.put("context", objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(context));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize extraction context", e);
        }
        boolean hasExcluded = excludedDomain != null && !excludedDomain.isBlank();
        variables.put("hasExcludedDomain", hasExcluded);
        variables.put("excludedDomain", hasExcluded ? excludedDomain.trim() : "");
        variables.put("minConfidence", props.getExtraction().getMinConfidence());
        variables.put("maxIndex", batch.size() - 1);
        return variables;
    }

    /**
     * Accepts {@code {"companies":[...]}} or a bare array. Items without a name or below the
     * confidence floor are dropped here.
     */
    List<ExtractedCompanyPayload> parseCompanies(String content) {
        JsonNode root;
        try {
            root = objectMapper.readTree(LlmJson.stripCodeFences(content));
        } catch (JsonProcessingException e) {
            log.warn("⚠️ Model returned malformed JSON, no candidates from this pass: {}", e.getOriginalMessage());
            return List.of();
        }
        if (root == null) {
            return List.of();
        }

        JsonNode array = root.isArray() ? root : root.path("companies");
        if (!array.isArray()) {
            log.warn("⚠️ Model output has no companies array");
            return List.of();
        }

        ExtractionProperties config = props.getExtraction();
        List<ExtractedCompanyPayload> items = new ArrayList<>();
        for (JsonNode node : array) {
            ExtractedCompanyPayload item;
            try {
                item = objectMapper.convertValue(node, ExtractedCompanyPayload.class);
            } catch (IllegalArgumentException e) {
                log.debug("Skipping unreadable company item: {}", node);
                continue;
            }
            double confidence = item.getConfidence() != null ? item.getConfidence() : config.getDefaultConfidence();
            if (!item.hasName() || confidence < config.getMinConfidence()) {
                log.debug("Filtered out: {} (confidence {})", item.hasName() ? item.getCompanyName() : "(no name)", confidence);
                continue;
            }
            item.setConfidence(confidence);
            items.add(item);
        }
        return items;
    }

    /**
     * Applies index, domain, publication, exclusion and name checks in that order.
     *
     * @return the candidate, or {@code null} when the item is dropped
     */
    Candidate validate(ExtractedCompanyPayload item, List<SearchHit> batch, String excludedDomain) {
        String name = item.getCompanyName().trim();
        Integer index = item.getIndex();
        if (index == null || index < 0 || index >= batch.size()) {
            log.debug("Dropped {}: invalid hit index {}", name, index);
            return null;
        }

        SearchHit hit = batch.get(index);
        String domain = DomainUtils.extractDomain(hit.getUrl());
        if (item.getCompanyDomain() != null && domain != null && !domain.equalsIgnoreCase(item.getCompanyDomain())) {
            log.debug("Model domain {} for {} replaced by {}", item.getCompanyDomain(), name, domain);
        }

        if (DomainUtils.isNewsDomain(domain) || DomainUtils.isMediaCompanyName(name)) {
            log.debug("Dropped {}: publication ({})", name, domain);
            return null;
        }
        if (DomainUtils.matchesExcludedDomain(domain, excludedDomain)) {
            log.debug("Dropped {}: excluded domain {}", name, domain);
            return null;
        }
        if (!DomainUtils.domainMatchesCompany(domain, name)) {
            log.debug("Dropped {}: domain {} does not match company name", name, domain);
            return null;
        }

        String headline = item.getSignalTitle() != null && !item.getSignalTitle().isBlank()
                ? item.getSignalTitle().trim()
                : OpportunityScorer.PLACEHOLDER_HEADLINE;

        return Candidate.builder()
                .companyName(name)
                .companyDomain(domain)
                .signalType(SignalType.parse(item.getSignalType()))
                .signalHeadline(headline)
                .signalDate(parseSignalDate(item.getSignalDate()))
                .sourceUrl(hit.getUrl())
                .sourceType(SourceType.parse(item.getSourceType()))
                .sourceTitle(hit.getTitle())
                .matchScore((int) Math.round(hit.getRelevanceScore() * 100))
                .confidence(Math.max(0.0, Math.min(1.0, item.getConfidence())))
                .build();
    }

    static LocalDate parseSignalDate(String raw) {
        if (raw == null || raw.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(raw.substring(0, 10));
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
