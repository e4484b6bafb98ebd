package com.numaansystems.openam.exception;

/**
 * Raised when the attribute map returned by OpenAM cannot be turned into a profile.
 */
public class ProfileMappingException extends OpenAmException {

    private static final long serialVersionUID = 1L;

    public ProfileMappingException(String message) {
        super(message);
    }

    public ProfileMappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
