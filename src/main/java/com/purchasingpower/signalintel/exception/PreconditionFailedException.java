package com.purchasingpower.signalintel.exception;

/**
 * Request cannot be served as sent: the query is too short or a required credential is
 * missing. Raised before any external call is made and never retried.
 */
public class PreconditionFailedException extends RuntimeException {

    public PreconditionFailedException(String message) {
        super(message);
    }
}
