package com.numaansystems.openam.exception;

/**
 * Raised at construction time when a required setting is missing or invalid.
 *
 * <p>Thrown while the Spring context starts, so a misconfigured gateway
 * never serves a request.</p>
 */
public class OpenAmConfigurationException extends OpenAmException {

    private static final long serialVersionUID = 1L;

    public OpenAmConfigurationException(String message) {
        super(message);
    }

    public OpenAmConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
