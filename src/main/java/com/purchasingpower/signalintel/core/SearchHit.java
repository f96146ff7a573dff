package com.purchasingpower.signalintel.core;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * One semantic-search result. Lives only for the duration of a request.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class SearchHit {

    String id;

    String url;

    String title;

    OffsetDateTime publishedAt;

    /**
     * Provider relevance, typically 0.0-1.0.
     */
    double relevanceScore;

    /**
     * Page body text as returned by the search provider; may be long or absent.
     */
    String snippetText;
}
