package com.purchasingpower.signalintel.service.cache;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Cache key derivation. Queries differing only in case or surrounding whitespace share a key.
 */
public final class CacheKeys {

    private CacheKeys() {
    }

    public static String of(String query, String excludedDomain) {
        String normalized = (query == null ? "" : query.trim().toLowerCase(Locale.ROOT))
                + "|"
                + (excludedDomain == null ? "" : excludedDomain.trim().toLowerCase(Locale.ROOT));
        return Hashing.sha256().hashString(normalized, StandardCharsets.UTF_8).toString();
    }
}
