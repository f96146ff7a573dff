package com.purchasingpower.signalintel.core;

/**
 * Health of an optional external capability for the duration of one request.
 *
 * <p>A capability starts {@link #ENABLED} or {@link #DISABLED_MISSING_CREDENTIAL} and can only
 * move to {@link #DISABLED_UPSTREAM_REJECTED}; it never comes back within a request.
 *
 * @since 1.0.0
 */
public enum CapabilityStatus {
    ENABLED,
    DISABLED_MISSING_CREDENTIAL,
    DISABLED_UPSTREAM_REJECTED;

    public boolean isEnabled() {
        return this == ENABLED;
    }
}
