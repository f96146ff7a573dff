package com.purchasingpower.signalintel.service.cache;

import com.purchasingpower.signalintel.core.IntelligenceResult;

import java.util.List;
import java.util.Optional;

/**
 * Keyed result cache around the whole pipeline.
 *
 * <p>Implementations never throw: a failing read is a miss and a failing write is dropped.
 */
public interface ResultCache {

    /**
     * Cached results for the key, when an unexpired non-empty entry exists and, if
     * {@code includeContacts} is set, at least one of its results carries a contact.
     */
    Optional<List<IntelligenceResult>> lookup(String query, String excludedDomain, boolean includeContacts);

    /**
     * Stores a run. Empty result sets are not stored.
     */
    void store(CachedRun run);

    /**
     * Deletes expired entries.
     *
     * @return number of runs removed
     */
    int purgeExpired();
}
