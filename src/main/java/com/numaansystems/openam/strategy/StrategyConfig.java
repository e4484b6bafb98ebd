package com.numaansystems.openam.strategy;

import com.numaansystems.openam.exception.OpenAmConfigurationException;

import java.net.URI;

/**
 * Immutable settings of an {@link OpenAmStrategy}.
 *
 * <p>Built once at start-up and shared read-only by every request.
 * {@link Builder#build()} fails fast with an
 * {@link OpenAmConfigurationException} when the OpenAM base URL or the
 * callback URL is missing, or the callback URL cannot be parsed.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public final class StrategyConfig {

    public static final String DEFAULT_REALM = "/";
    public static final String DEFAULT_COOKIE_NAME = "iPlanetDirectoryPro";

    private final String identityProviderBaseUrl;
    private final String realm;
    private final String sessionCookieName;
    private final String callbackUrl;
    private final SkipProfilePolicy skipProfilePolicy;
    private final boolean showLoginPage;

    private StrategyConfig(Builder builder) {
        this.identityProviderBaseUrl = builder.identityProviderBaseUrl;
        this.realm = builder.realm;
        this.sessionCookieName = builder.sessionCookieName;
        this.callbackUrl = builder.callbackUrl;
        this.skipProfilePolicy = builder.skipProfilePolicy;
        this.showLoginPage = builder.showLoginPage;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getIdentityProviderBaseUrl() {
        return identityProviderBaseUrl;
    }

    public String getRealm() {
        return realm;
    }

    public String getSessionCookieName() {
        return sessionCookieName;
    }

    public String getCallbackUrl() {
        return callbackUrl;
    }

    public SkipProfilePolicy getSkipProfilePolicy() {
        return skipProfilePolicy;
    }

    /**
     * Whether the OpenAM login page is shown. Informational only, the
     * handshake always redirects to it.
     */
    public boolean isShowLoginPage() {
        return showLoginPage;
    }

    @Override
    public String toString() {
        return "StrategyConfig{baseUrl='" + identityProviderBaseUrl + "', realm='" + realm
                + "', cookieName='" + sessionCookieName + "', callbackUrl='" + callbackUrl + "'}";
    }

    /**
     * Builder for {@link StrategyConfig}. Unset optional values take their defaults.
     */
    public static final class Builder {

        private String identityProviderBaseUrl;
        private String realm = DEFAULT_REALM;
        private String sessionCookieName = DEFAULT_COOKIE_NAME;
        private String callbackUrl;
        private SkipProfilePolicy skipProfilePolicy = SkipProfilePolicy.never();
        private boolean showLoginPage = true;

        private Builder() {
        }

        public Builder identityProviderBaseUrl(String identityProviderBaseUrl) {
            this.identityProviderBaseUrl = identityProviderBaseUrl;
            return this;
        }

        public Builder realm(String realm) {
            this.realm = realm;
            return this;
        }

        public Builder sessionCookieName(String sessionCookieName) {
            this.sessionCookieName = sessionCookieName;
            return this;
        }

        public Builder callbackUrl(String callbackUrl) {
            this.callbackUrl = callbackUrl;
            return this;
        }

        public Builder skipProfilePolicy(SkipProfilePolicy skipProfilePolicy) {
            this.skipProfilePolicy = skipProfilePolicy;
            return this;
        }

        public Builder showLoginPage(boolean showLoginPage) {
            this.showLoginPage = showLoginPage;
            return this;
        }

        /**
         * @return the validated configuration
         * @throws OpenAmConfigurationException if a required value is missing
         */
        public StrategyConfig build() {
            if (isBlank(identityProviderBaseUrl)) {
                throw new OpenAmConfigurationException("OpenAmStrategy requires an openAmBaseUrl option");
            }
            if (isBlank(callbackUrl)) {
                throw new OpenAmConfigurationException("OpenAmStrategy requires a callbackUrl option");
            }
            try {
                URI.create(callbackUrl);
            } catch (IllegalArgumentException e) {
                throw new OpenAmConfigurationException(
                        "OpenAmStrategy callbackUrl is not a valid URL: " + callbackUrl, e);
            }
            if (realm == null) {
                realm = DEFAULT_REALM;
            }
            if (isBlank(sessionCookieName)) {
                sessionCookieName = DEFAULT_COOKIE_NAME;
            }
            if (skipProfilePolicy == null) {
                skipProfilePolicy = SkipProfilePolicy.never();
            }
            return new StrategyConfig(this);
        }

        private static boolean isBlank(String value) {
            return value == null || value.isBlank();
        }
    }
}
