package com.purchasingpower.signalintel.service.pipeline;

import com.purchasingpower.signalintel.core.Capability;
import com.purchasingpower.signalintel.core.CapabilityStatus;
import com.purchasingpower.signalintel.core.RequestCredentials;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;

/**
 * State of one pipeline run: credentials, per-capability health and the cost ledger.
 *
 * <p>Created per request and never shared between requests. Capability status transitions
 * are synchronized because enrichment workers may report rejections concurrently.
 */
@Slf4j
@Getter
public class PipelineContext {

    private final String query;
    private final String excludedDomain;
    private final RequestCredentials credentials;
    private final CostLedger costs = new CostLedger();
    private final Map<Capability, CapabilityStatus> capabilities = new EnumMap<>(Capability.class);

    public PipelineContext(String query, String excludedDomain, RequestCredentials credentials) {
        this.query = query;
        this.excludedDomain = excludedDomain;
        this.credentials = credentials;
        capabilities.put(Capability.LANGUAGE_MODEL,
                isBlank(credentials.getLlmApiKey())
                        ? CapabilityStatus.DISABLED_MISSING_CREDENTIAL
                        : CapabilityStatus.ENABLED);
        capabilities.put(Capability.CONTACT_ENRICHMENT,
                credentials.hasEnrichmentKey()
                        ? CapabilityStatus.ENABLED
                        : CapabilityStatus.DISABLED_MISSING_CREDENTIAL);
    }

    public synchronized CapabilityStatus statusOf(Capability capability) {
        return capabilities.get(capability);
    }

    public boolean isEnabled(Capability capability) {
        return statusOf(capability).isEnabled();
    }

    /**
     * Disables a capability after the provider rejected our credential.
     */
    public synchronized void markRejected(Capability capability) {
        if (capabilities.get(capability) == CapabilityStatus.ENABLED) {
            log.warn("⚠️ {} disabled for this request: upstream rejected credential", capability);
            capabilities.put(capability, CapabilityStatus.DISABLED_UPSTREAM_REJECTED);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
