package com.purchasingpower.signalintel.api;

import com.purchasingpower.signalintel.api.CredentialResolver.CredentialHeaders;
import com.purchasingpower.signalintel.core.RequestCredentials;
import com.purchasingpower.signalintel.exception.PreconditionFailedException;
import com.purchasingpower.signalintel.service.IntelligenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for signal searches.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/intelligence")
@RequiredArgsConstructor
public class IntelligenceController {

    private final IntelligenceService intelligenceService;
    private final CredentialResolver credentialResolver;

    /**
     * Find companies with business signals matching a query.
     *
     * POST /api/v1/intelligence
     */
    @PostMapping
    public ResponseEntity<IntelligenceResponse> search(
            @RequestBody IntelligenceRequest request,
            @RequestHeader(value = "x-exa-key", required = false) String exaKey,
            @RequestHeader(value = "x-ai-provider", required = false) String providerTag,
            @RequestHeader(value = "x-openai-key", required = false) String openaiKey,
            @RequestHeader(value = "x-azure-key", required = false) String azureKey,
            @RequestHeader(value = "x-azure-endpoint", required = false) String azureEndpoint,
            @RequestHeader(value = "x-azure-deployment", required = false) String azureDeployment,
            @RequestHeader(value = "x-anthropic-key", required = false) String anthropicKey,
            @RequestHeader(value = "x-apollo-key", required = false) String apolloKey) {

        try {
            RequestCredentials credentials = credentialResolver.resolve(new CredentialHeaders(
                    exaKey, providerTag, openaiKey, azureKey, azureEndpoint, azureDeployment, anthropicKey, apolloKey));

            IntelligenceResponse response = intelligenceService.execute(request, credentials);
            return response.isSuccess()
                    ? ResponseEntity.ok(response)
                    : ResponseEntity.internalServerError().body(response);

        } catch (PreconditionFailedException e) {
            log.info("Rejected request: {}", e.getMessage());
            return ResponseEntity.badRequest()
                    .body(IntelligenceResponse.failure(e.getMessage(), request.getQuery(), 0));
        }
    }
}
