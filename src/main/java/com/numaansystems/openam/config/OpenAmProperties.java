package com.numaansystems.openam.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * OpenAM settings bound from the {@code openam.*} properties.
 *
 * <h2>Configuration</h2>
 * <pre>
 * openam:
 *   base-url: https://sso.example.com/openam/
 *   callback-url: http://localhost:8080/auth/openam/callback
 *   realm: /
 *   cookie-name: iPlanetDirectoryPro
 *   skip-user-profile: false
 *   login-page: true
 *   connect-timeout: 5s
 *   response-timeout: 10s
 *   connection-request-timeout: 5s
 *   max-connections: 50
 *   max-connections-per-route: 20
 *   handshake-pool-size: 8
 * </pre>
 *
 * <p>{@code base-url} and {@code callback-url} are required; start-up fails
 * without them.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@ConfigurationProperties(prefix = "openam")
public class OpenAmProperties {

    private String baseUrl;
    private String callbackUrl;
    private String realm = "/";
    private String cookieName = "iPlanetDirectoryPro";
    private boolean skipUserProfile = false;
    private boolean loginPage = true;
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration responseTimeout = Duration.ofSeconds(10);
    private Duration connectionRequestTimeout = Duration.ofSeconds(5);
    private int maxConnections = 50;
    private int maxConnectionsPerRoute = 20;
    private int handshakePoolSize = 8;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getCallbackUrl() {
        return callbackUrl;
    }

    public void setCallbackUrl(String callbackUrl) {
        this.callbackUrl = callbackUrl;
    }

    public String getRealm() {
        return realm;
    }

    public void setRealm(String realm) {
        this.realm = realm;
    }

    public String getCookieName() {
        return cookieName;
    }

    public void setCookieName(String cookieName) {
        this.cookieName = cookieName;
    }

    public boolean isSkipUserProfile() {
        return skipUserProfile;
    }

    public void setSkipUserProfile(boolean skipUserProfile) {
        this.skipUserProfile = skipUserProfile;
    }

    public boolean isLoginPage() {
        return loginPage;
    }

    public void setLoginPage(boolean loginPage) {
        this.loginPage = loginPage;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getResponseTimeout() {
        return responseTimeout;
    }

    public void setResponseTimeout(Duration responseTimeout) {
        this.responseTimeout = responseTimeout;
    }

    /**
     * Maximum time a provider call waits for a pooled connection.
     */
    public Duration getConnectionRequestTimeout() {
        return connectionRequestTimeout;
    }

    public void setConnectionRequestTimeout(Duration connectionRequestTimeout) {
        this.connectionRequestTimeout = connectionRequestTimeout;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public void setMaxConnections(int maxConnections) {
        this.maxConnections = maxConnections;
    }

    public int getMaxConnectionsPerRoute() {
        return maxConnectionsPerRoute;
    }

    public void setMaxConnectionsPerRoute(int maxConnectionsPerRoute) {
        this.maxConnectionsPerRoute = maxConnectionsPerRoute;
    }

    /**
     * Threads that run handshake stages after OpenAM has answered.
     */
    public int getHandshakePoolSize() {
        return handshakePoolSize;
    }

    public void setHandshakePoolSize(int handshakePoolSize) {
        this.handshakePoolSize = handshakePoolSize;
    }
}
