package com.purchasingpower.signalintel.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request for a signal search.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntelligenceRequest {

    public static final int DEFAULT_RESULT_COUNT = 5;

    /**
     * Company name, keywords, or a description of the ideal prospect.
     */
    private String query;

    /**
     * The caller's own company domain; never returned as a result.
     */
    @JsonAlias("prospectDomain")
    private String excludedDomain;

    @JsonAlias("numResults")
    private Integer resultCount;

    private Boolean includeContacts;

    public int resultCountOrDefault() {
        return resultCount != null ? resultCount : DEFAULT_RESULT_COUNT;
    }

    public boolean includeContactsOrDefault() {
        return includeContacts == null || includeContacts;
    }
}
