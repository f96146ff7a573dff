package com.purchasingpower.signalintel.exception;

import com.purchasingpower.signalintel.model.ServiceType;
import lombok.Getter;

/**
 * Failure of an external provider call (search, language model, enrichment).
 *
 * <p>Call sites catch this and move their stage to its fallback. {@link #isRejected()}
 * distinguishes credential rejections, which disable the capability for the rest of the
 * request, from transient or malformed responses.
 */
@Getter
public class ProviderException extends RuntimeException {

    private final ServiceType service;

    /**
     * HTTP status reported by the provider, or {@code -1} for transport failures.
     */
    private final int statusCode;

    public ProviderException(ServiceType service, int statusCode, String message, Throwable cause) {
        super(service.getName() + " call failed: " + message, cause);
        this.service = service;
        this.statusCode = statusCode;
    }

    public ProviderException(ServiceType service, String message, Throwable cause) {
        this(service, -1, message, cause);
    }

    public boolean isRejected() {
        return statusCode == 401 || statusCode == 403;
    }
}
