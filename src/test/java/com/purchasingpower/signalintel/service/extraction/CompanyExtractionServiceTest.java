package com.purchasingpower.signalintel.service.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.signalintel.client.LLMCompletion;
import com.purchasingpower.signalintel.client.LLMProvider;
import com.purchasingpower.signalintel.client.LLMProviderFactory;
import com.purchasingpower.signalintel.client.LLMRequest;
import com.purchasingpower.signalintel.configuration.AppProperties;
import com.purchasingpower.signalintel.core.Candidate;
import com.purchasingpower.signalintel.core.ProviderType;
import com.purchasingpower.signalintel.core.RequestCredentials;
import com.purchasingpower.signalintel.core.SearchHit;
import com.purchasingpower.signalintel.core.SignalType;
import com.purchasingpower.signalintel.core.SourceType;
import com.purchasingpower.signalintel.exception.ProviderException;
import com.purchasingpower.signalintel.model.ServiceType;
import com.purchasingpower.signalintel.service.PromptLibraryService;
import com.purchasingpower.signalintel.service.pipeline.PipelineContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("Company Extraction Service Tests")
class CompanyExtractionServiceTest {

    private LLMProvider provider;
    private CompanyExtractionService service;

    @BeforeEach
    void setUp() {
        provider = mock(LLMProvider.class);
        when(provider.getProviderName()).thenReturn("stub");
        LLMProviderFactory factory = mock(LLMProviderFactory.class);
        when(factory.getProvider(ProviderType.OPENAI)).thenReturn(provider);

        PromptLibraryService prompts = new PromptLibraryService();
        prompts.loadPrompts();

        AppProperties props = new AppProperties();
        Clock clock = Clock.fixed(Instant.parse("2025-06-15T12:00:00Z"), ZoneOffset.UTC);
        service = new CompanyExtractionService(factory, prompts, new OpportunityScorer(props, clock),
                new ObjectMapper().findAndRegisterModules(), props);
    }

    private static PipelineContext context(String excludedDomain) {
        return new PipelineContext("acme", excludedDomain, RequestCredentials.builder()
                .searchApiKey("exa")
                .llmProvider(ProviderType.OPENAI)
                .llmApiKey("sk-test")
                .build());
    }

    private static SearchHit hit(String url, String title) {
        return SearchHit.builder().id(url).url(url).title(title).relevanceScore(0.82).snippetText("body").build();
    }

    private void modelReturns(String content) {
        when(provider.complete(any(LLMRequest.class), any(RequestCredentials.class)))
                .thenReturn(LLMCompletion.builder().content(content).cost(0.002).build());
    }

    @Test
    @DisplayName("Domain is re-derived from the hit URL, never taken from the model")
    void testDomainRederivation() {
        // Given
        List<SearchHit> hits = List.of(hit("https://www.acme.com/news/series-a", "Acme raises $10M"));
        modelReturns("""
                {"companies":[{"companyName":"Acme Inc","companyDomain":"technews.example","signalType":"funding",
                "signalTitle":"Raised $10M Series A","signalDate":"2025-06-10","sourceType":"company_page",
                "confidence":0.9,"index":0}]}""");

        // When
        ExtractionOutcome outcome = service.extract(hits, context(null));

        // Then
        assertEquals(1, outcome.candidates().size());
        Candidate acme = outcome.candidates().get(0);
        assertEquals("acme.com", acme.getCompanyDomain());
        assertEquals(SignalType.FUNDING, acme.getSignalType());
        assertEquals(SourceType.COMPANY_PAGE, acme.getSourceType());
        assertEquals(LocalDate.of(2025, 6, 10), acme.getSignalDate());
        assertEquals(82, acme.getMatchScore());
        assertEquals("Acme raises $10M", acme.getSourceTitle());
        assertEquals(40, acme.getOpportunityScore());
    }

    @Test
    @DisplayName("A company reported on a publication's own domain is dropped, not misattributed")
    void testMisattributionGuard() {
        // Given
        List<SearchHit> hits = List.of(hit("https://technews.example/acme-raises-10m", "Acme Inc raised $10M"));
        modelReturns("""
                {"companies":[{"companyName":"Acme Inc","companyDomain":"technews.example",
                "signalType":"funding","signalTitle":"Raised $10M","confidence":0.9,"index":0}]}""");

        // When
        ExtractionOutcome outcome = service.extract(hits, context(null));

        // Then
        assertThat(outcome.candidates())
                .extracting(Candidate::getCompanyDomain)
                .doesNotContain("technews.example");
        assertTrue(outcome.candidates().isEmpty());
    }

    @Test
    @DisplayName("Items with a missing or out-of-range index are dropped")
    void testIndexSanity() {
        List<SearchHit> hits = List.of(
                hit("https://acme.com/a", "Acme"),
                hit("https://beta.io/b", "Beta"));
        modelReturns("""
                {"companies":[
                  {"companyName":"Acme","signalType":"hiring","signalTitle":"Hiring","confidence":0.9},
                  {"companyName":"Beta","signalType":"hiring","signalTitle":"Hiring","confidence":0.9,"index":7},
                  {"companyName":"Beta","signalType":"hiring","signalTitle":"Hiring","confidence":0.9,"index":1}
                ]}""");

        ExtractionOutcome outcome = service.extract(hits, context(null));

        assertEquals(3, outcome.parsed());
        assertEquals(1, outcome.candidates().size());
        assertEquals("beta.io", outcome.candidates().get(0).getCompanyDomain());
    }

    @Test
    @DisplayName("Publications, media brands and the excluded domain are filtered")
    void testNewsAndExclusionFiltering() {
        List<SearchHit> hits = List.of(
                hit("https://techcrunch.com/octaura", "Octaura raises $46M"),
                hit("https://myco.com/blog", "MyCo expands"),
                hit("https://reuters-partner.net/x", "Reuters story"),
                hit("https://octaura.com/press", "Octaura press"));
        modelReturns("""
                {"companies":[
                  {"companyName":"Octaura","signalType":"funding","signalTitle":"Raised $46M","confidence":0.9,"index":0},
                  {"companyName":"MyCo","signalType":"expansion","signalTitle":"Expands","confidence":0.9,"index":1},
                  {"companyName":"Reuters","signalType":"other","signalTitle":"Story","confidence":0.9,"index":2},
                  {"companyName":"Octaura","signalType":"funding","signalTitle":"Raised $46M","confidence":0.9,"index":3}
                ]}""");

        ExtractionOutcome outcome = service.extract(hits, context("myco.com"));

        assertThat(outcome.candidates())
                .extracting(Candidate::getCompanyDomain)
                .containsExactly("octaura.com");
    }

    @Test
    @DisplayName("Bare arrays, snake_case fields and code fences are accepted")
    void testLenientParsing() {
        List<SearchHit> hits = List.of(hit("https://acme.com/jobs", "Careers at Acme"));
        modelReturns("""
                ```json
                [{"company_name":"Acme","signal_type":"exec_change","signal_title":"New CFO appointed",
                  "source_type":"press_release","index":0}]
                ```""");

        ExtractionOutcome outcome = service.extract(hits, context(null));

        assertEquals(1, outcome.candidates().size());
        Candidate acme = outcome.candidates().get(0);
        assertEquals(SignalType.EXEC_CHANGE, acme.getSignalType());
        assertEquals(SourceType.PRESS_RELEASE, acme.getSourceType());
        assertEquals(0.8, acme.getConfidence(), 1e-9);
        assertEquals("Leadership transition", acme.getOpportunityReason());
    }

    @Test
    @DisplayName("Low-confidence and nameless items are dropped")
    void testConfidenceFloor() {
        List<SearchHit> hits = List.of(hit("https://acme.com", "Acme"));
        modelReturns("""
                {"companies":[
                  {"companyName":"Acme","confidence":0.1,"index":0},
                  {"confidence":0.9,"index":0}
                ]}""");

        ExtractionOutcome outcome = service.extract(hits, context(null));

        assertEquals(0, outcome.parsed());
        assertTrue(outcome.candidates().isEmpty());
    }

    @Test
    @DisplayName("Malformed model output yields zero candidates but the cost is still recorded")
    void testMalformedOutput() {
        List<SearchHit> hits = List.of(hit("https://acme.com", "Acme"));
        modelReturns("Sorry, I cannot help with that.");
        PipelineContext context = context(null);

        ExtractionOutcome outcome = service.extract(hits, context);

        assertTrue(outcome.candidates().isEmpty());
        assertEquals(0.002, context.getCosts().getModel(), 1e-9);
    }

    @Test
    @DisplayName("Excluded domain is named in the prompt")
    void testPromptMentionsExcludedDomain() {
        modelReturns("{\"companies\": []}");

        service.extract(List.of(hit("https://acme.com", "Acme")), context("myco.com"));

        ArgumentCaptor<LLMRequest> request = ArgumentCaptor.forClass(LLMRequest.class);
        verify(provider).complete(request.capture(), any(RequestCredentials.class));
        assertThat(request.getValue().getUserPrompt())
                .contains("EXCLUDE any company with domain containing: myco.com")
                .contains("\"url\" : \"https://acme.com\"");
        assertTrue(request.getValue().isJsonMode());
        assertEquals(0.1, request.getValue().getTemperature(), 1e-9);
    }

    @Test
    @DisplayName("Provider failures propagate to the caller")
    void testProviderFailurePropagates() {
        when(provider.complete(any(LLMRequest.class), any(RequestCredentials.class)))
                .thenThrow(new ProviderException(ServiceType.OPENAI, 500, "boom", null));

        assertThrows(ProviderException.class,
                () -> service.extract(List.of(hit("https://acme.com", "Acme")), context(null)));
    }
}
