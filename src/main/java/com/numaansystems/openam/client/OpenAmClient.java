package com.numaansystems.openam.client;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * I/O boundary to the OpenAM identity REST endpoints.
 *
 * <p>Holds no decision logic. Implementations must be thread-safe; a single
 * instance serves all concurrent requests.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public interface OpenAmClient {

    /**
     * Asks OpenAM whether the session token is still valid.
     *
     * @param token the value of the OpenAM session cookie
     * @return a future completing with {@code true} for a live session and
     *         {@code false} otherwise; completes exceptionally with
     *         {@link com.numaansystems.openam.exception.InternalOpenAmException}
     *         when the server cannot be reached
     */
    CompletableFuture<Boolean> isTokenValid(String token);

    /**
     * Fetches the identity attributes attached to the session token.
     *
     * @param token the value of the OpenAM session cookie
     * @return a future completing with attribute name to (first) value
     */
    CompletableFuture<Map<String, String>> getAttributes(String token);

    /**
     * Builds the URL of the interactive OpenAM login page.
     *
     * @param params query parameters, must include {@code goto}
     * @return the absolute login URL
     */
    String getLoginUiUrl(Map<String, String> params);

    /**
     * Builds the URL of the interactive OpenAM logout page.
     *
     * @param params query parameters, usually {@code goto}
     * @return the absolute logout URL
     */
    String getLogoutUiUrl(Map<String, String> params);
}
