package com.purchasingpower.signalintel.core;

/**
 * External capabilities whose availability is tracked per request.
 *
 * @since 1.0.0
 */
public enum Capability {
    LANGUAGE_MODEL,
    CONTACT_ENRICHMENT
}
