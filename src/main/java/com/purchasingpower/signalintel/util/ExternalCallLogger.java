package com.purchasingpower.signalintel.util;

import com.purchasingpower.signalintel.model.CallContext;
import com.purchasingpower.signalintel.model.ServiceType;
import org.slf4j.Logger;

/**
 * Unified logging utility for all external service calls (Exa, model backends, Apollo).
 * Provides consistent, structured request/response logging.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Truncate large strings for logging (to avoid log spam)
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }

    /**
     * Keeps only the first few characters of a credential for diagnostics.
     */
    public static String mask(String secret) {
        if (secret == null || secret.isBlank()) {
            return "EMPTY";
        }
        return secret.substring(0, Math.min(4, secret.length())) + "****";
    }
}
