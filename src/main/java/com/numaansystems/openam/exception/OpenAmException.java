package com.numaansystems.openam.exception;

/**
 * Base type for all failures raised by the OpenAM integration.
 *
 * <p>Unchecked so that it can travel through {@code CompletableFuture}
 * stages and reach the {@code error} outcome channel unchanged.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class OpenAmException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public OpenAmException(String message) {
        super(message);
    }

    public OpenAmException(String message, Throwable cause) {
        super(message, cause);
    }
}
