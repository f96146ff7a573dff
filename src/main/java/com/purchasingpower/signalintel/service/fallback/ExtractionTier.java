package com.purchasingpower.signalintel.service.fallback;

/**
 * Extraction strategies in escalation order.
 */
public enum ExtractionTier {

    /** Model extraction over the primary search hits. Always runs. */
    MODEL_PRIMARY,

    /** One literal re-search of the raw query plus model extraction. Descriptive queries only. */
    MODEL_LITERAL_RESEARCH,

    /** Candidates built from hit URLs and titles without a model call. */
    TITLE_DERIVED;

    /**
     * The tier after this one, or {@code null} at the end of the chain.
     */
    public ExtractionTier next() {
        int ordinal = ordinal() + 1;
        return ordinal < values().length ? values()[ordinal] : null;
    }
}
