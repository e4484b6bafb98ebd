package com.numaansystems.openam.strategy;

/**
 * Per-request overrides for {@link OpenAmStrategy#authenticate}.
 */
public final class AuthenticateOptions {

    private static final AuthenticateOptions DEFAULTS = new AuthenticateOptions(null);

    private final String callbackUrl;

    private AuthenticateOptions(String callbackUrl) {
        this.callbackUrl = callbackUrl;
    }

    public static AuthenticateOptions defaults() {
        return DEFAULTS;
    }

    /**
     * @param callbackUrl callback URL used instead of the configured one; may be relative
     */
    public static AuthenticateOptions withCallbackUrl(String callbackUrl) {
        return new AuthenticateOptions(callbackUrl);
    }

    public String getCallbackUrl() {
        return callbackUrl;
    }
}
