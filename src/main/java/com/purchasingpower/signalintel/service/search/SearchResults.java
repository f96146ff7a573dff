package com.purchasingpower.signalintel.service.search;

import com.purchasingpower.signalintel.core.SearchHit;

import java.util.List;

/**
 * Merged hits of a search stage plus the first provider request id, kept for the cache record.
 */
public record SearchResults(List<SearchHit> hits, String requestId) {

    public boolean isEmpty() {
        return hits.isEmpty();
    }
}
