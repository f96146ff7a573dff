package com.purchasingpower.signalintel.service.planning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.signalintel.client.LLMCompletion;
import com.purchasingpower.signalintel.client.LLMProvider;
import com.purchasingpower.signalintel.client.LLMProviderFactory;
import com.purchasingpower.signalintel.client.LLMRequest;
import com.purchasingpower.signalintel.configuration.AppProperties;
import com.purchasingpower.signalintel.core.Capability;
import com.purchasingpower.signalintel.exception.ProviderException;
import com.purchasingpower.signalintel.model.prompt.RenderedPrompt;
import com.purchasingpower.signalintel.service.PromptLibraryService;
import com.purchasingpower.signalintel.service.pipeline.PipelineContext;
import com.purchasingpower.signalintel.util.LlmJson;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * QueryPlanner - decides between a literal search and a set of generated searches.
 *
 * Short inputs ("acme robotics") are searched as typed. Longer inputs describe an ideal
 * prospect; for those the model writes complementary queries, each aimed at a different
 * angle (hiring, funding, growth, news, industry).
 *
 * Planning never fails the request: any problem degrades to searching the original text.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryPlanner {

    static final String PROMPT_NAME = "query-planner";
    static final int MAX_TOKENS = 500;

    private final LLMProviderFactory providerFactory;
    private final PromptLibraryService promptLibrary;
    private final ObjectMapper objectMapper;
    private final AppProperties props;
    private final Clock clock;

    public boolean isDescriptiveQuery(String query) {
        if (query == null || query.isBlank()) {
            return false;
        }
        return query.trim().split("\\s+").length >= props.getFallback().getDescriptiveWordThreshold();
    }

    /**
     * Build the query plan for the request in {@code context}. Model cost is recorded on the
     * context's ledger.
     */
    public QueryPlan plan(PipelineContext context) {
        String query = context.getQuery();
        if (!isDescriptiveQuery(query)) {
            return QueryPlan.literal(query);
        }

        if (!context.isEnabled(Capability.LANGUAGE_MODEL)) {
            log.warn("⚠️ Language model unavailable ({}), searching description as typed",
                    context.statusOf(Capability.LANGUAGE_MODEL));
            return new QueryPlan(true, List.of(query), 0.0);
        }

        int queryCount = props.getFallback().getMaxGeneratedQueries();
        int year = Year.now(clock).getValue();
        RenderedPrompt prompt = promptLibrary.render(PROMPT_NAME, Map.of(
                "description", query,
                "queryCount", queryCount,
                "currentYear", year,
                "previousYear", year - 1));

        LLMProvider provider = providerFactory.getProvider(context.getCredentials().getLlmProvider());
        double cost = 0.0;
        try {
            LLMCompletion completion = provider.complete(LLMRequest.builder()
                    .systemPrompt(prompt.systemPrompt())
                    .userPrompt(prompt.userPrompt())
                    .temperature(props.getLlm().getPlannerTemperature())
                    .jsonMode(false)
                    .maxTokens(MAX_TOKENS)
                    .purpose(PROMPT_NAME)
                    .build(), context.getCredentials());
            cost = completion.getCost();
            context.getCosts().addModel(cost);

            List<String> queries = parseQueries(completion.getContent(), queryCount);
            if (queries.isEmpty()) {
                log.warn("⚠️ Planner returned no usable queries, searching description as typed");
                return new QueryPlan(true, List.of(query), cost);
            }

            log.info("🧠 Generated {} search queries: {}", queries.size(), queries);
            return new QueryPlan(true, queries, cost);

        } catch (ProviderException e) {
            if (e.isRejected()) {
                context.markRejected(Capability.LANGUAGE_MODEL);
            }
            log.warn("⚠️ Query generation failed, searching description as typed: {}", e.getMessage());
            return new QueryPlan(true, List.of(query), cost);
        }
    }

    /**
     * First JSON array in the model output, reduced to at most {@code limit} non-blank strings.
     */
    List<String> parseQueries(String content, int limit) {
        String json = LlmJson.firstJsonArray(content);
        if (json == null) {
            return List.of();
        }
        try {
            JsonNode array = objectMapper.readTree(json);
            List<String> queries = new ArrayList<>();
            for (JsonNode item : array) {
                if (item.isTextual() && !item.asText().isBlank()) {
                    queries.add(item.asText().trim());
                }
                if (queries.size() == limit) {
                    break;
                }
            }
            return queries;
        } catch (JsonProcessingException e) {
            log.debug("Planner output is not a JSON array: {}", e.getOriginalMessage());
            return List.of();
        }
    }
}
