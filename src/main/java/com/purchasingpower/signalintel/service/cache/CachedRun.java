package com.purchasingpower.signalintel.service.cache;

import com.purchasingpower.signalintel.core.IntelligenceResult;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything persisted for one completed run.
 */
@Value
@Builder
public class CachedRun {

    String query;

    String excludedDomain;

    List<IntelligenceResult> results;

    String searchRequestId;

    double searchCost;

    double modelCost;

    double enrichmentCost;

    long latencyMs;
}
