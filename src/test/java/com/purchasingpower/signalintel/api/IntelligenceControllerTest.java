package com.purchasingpower.signalintel.api;

import com.purchasingpower.signalintel.core.Candidate;
import com.purchasingpower.signalintel.core.IntelligenceResult;
import com.purchasingpower.signalintel.core.ProviderType;
import com.purchasingpower.signalintel.core.RequestCredentials;
import com.purchasingpower.signalintel.core.SignalType;
import com.purchasingpower.signalintel.exception.PreconditionFailedException;
import com.purchasingpower.signalintel.service.IntelligenceService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web layer tests for the signal search endpoint.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Intelligence Controller Tests")
class IntelligenceControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private IntelligenceService intelligenceService;

    private static IntelligenceResponse sampleResponse() {
        Candidate acme = Candidate.builder()
                .companyName("Acme")
                .companyDomain("acme.com")
                .signalType(SignalType.EXEC_CHANGE)
                .signalHeadline("New CFO appointed")
                .opportunityScore(15)
                .build();
        List<IntelligenceResult> results = List.of(IntelligenceResult.withoutContact(acme));
        return IntelligenceResponse.success(results, IntelligenceResponse.Meta.builder()
                .query("acme")
                .resultCount(1)
                .costs(IntelligenceResponse.Costs.of(0.005, 0.0, 0.0))
                .marketActivity(IntelligenceResponse.MarketActivity.of(results))
                .build());
    }

    @Test
    @DisplayName("Successful search returns 200 with snake_case signal values")
    void testSuccess() throws Exception {
        when(intelligenceService.execute(any(), any())).thenReturn(sampleResponse());

        mockMvc.perform(post("/api/v1/intelligence")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("x-exa-key", "exa")
                        .header("x-ai-provider", "anthropic")
                        .header("x-anthropic-key", "sk-ant")
                        .content("{\"query\":\"acme\",\"numResults\":3,\"prospectDomain\":\"myco.com\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.results[0].company.signalType").value("exec_change"))
                .andExpect(jsonPath("$.meta.marketActivity.exec_change").value(1))
                .andExpect(jsonPath("$.meta.costs.total").value(0.005));

        ArgumentCaptor<IntelligenceRequest> request = ArgumentCaptor.forClass(IntelligenceRequest.class);
        ArgumentCaptor<RequestCredentials> credentials = ArgumentCaptor.forClass(RequestCredentials.class);
        verify(intelligenceService).execute(request.capture(), credentials.capture());
        assertEquals(Integer.valueOf(3), request.getValue().getResultCount());
        assertEquals("myco.com", request.getValue().getExcludedDomain());
        assertEquals(ProviderType.ANTHROPIC, credentials.getValue().getLlmProvider());
        assertEquals("sk-ant", credentials.getValue().getLlmApiKey());
        System.out.println("✅ Headers resolved to " + credentials.getValue().getLlmProvider());
    }

    @Test
    @DisplayName("Unknown AI provider is a 400 without calling the pipeline")
    void testUnknownProvider() throws Exception {
        mockMvc.perform(post("/api/v1/intelligence")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("x-ai-provider", "gemini")
                        .content("{\"query\":\"acme\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.meta.query").value("acme"));

        verifyNoInteractions(intelligenceService);
    }

    @Test
    @DisplayName("Precondition failures from the pipeline are a 400")
    void testPreconditionFailure() throws Exception {
        when(intelligenceService.execute(any(), any()))
                .thenThrow(new PreconditionFailedException("Query must be at least 3 characters"));

        mockMvc.perform(post("/api/v1/intelligence")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"ab\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Query must be at least 3 characters"));
    }

    @Test
    @DisplayName("Pipeline failures are a 500 with the error")
    void testPipelineFailure() throws Exception {
        when(intelligenceService.execute(any(), any()))
                .thenReturn(IntelligenceResponse.failure("Exa call failed: timeout", "acme", 120));

        mockMvc.perform(post("/api/v1/intelligence")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"acme\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.results").isEmpty());
    }
}
