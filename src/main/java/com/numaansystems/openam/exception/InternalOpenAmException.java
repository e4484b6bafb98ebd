package com.numaansystems.openam.exception;

/**
 * Raised when the OpenAM server cannot be reached or answers with an
 * unexpected status while validating a token or fetching attributes.
 *
 * <p>Always carries the underlying transport cause when there is one.
 * The host maps it to {@code 502 Bad Gateway}.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class InternalOpenAmException extends OpenAmException {

    private static final long serialVersionUID = 1L;

    public InternalOpenAmException(String message) {
        super(message);
    }

    public InternalOpenAmException(String message, Throwable cause) {
        super(message, cause);
    }
}
