package com.numaansystems.openam.strategy;

import com.numaansystems.openam.client.OpenAmClient;
import com.numaansystems.openam.exception.InternalOpenAmException;
import com.numaansystems.openam.profile.OpenAmProfile;
import com.numaansystems.openam.profile.ProfileMapper;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Authenticates requests against an OpenAM server using its session cookie.
 *
 * <h2>Handshake</h2>
 * <ol>
 *   <li>{@code error} query parameter present &rarr; fail</li>
 *   <li>no {@code code} query parameter &rarr; redirect to the OpenAM login
 *       page with {@code goto=<callbackUrl>?code=true}</li>
 *   <li>{@code code} present but no session cookie &rarr; same redirect</li>
 *   <li>session cookie present &rarr; ask OpenAM whether the token is valid;
 *       invalid tokens get the same redirect</li>
 *   <li>valid token &rarr; fetch and normalize the profile (unless skipped),
 *       then let the {@link VerifyCallback} decide success or fail</li>
 * </ol>
 *
 * <p>The strategy is stateless apart from its immutable configuration and
 * may serve any number of concurrent requests. Each stage gates the next;
 * transport and mapping failures always reach the {@code error} channel.
 * Stages after a provider call run on the supplied executor, never on the
 * HTTP client's I/O threads, so a blocking verify callback cannot stall
 * other OpenAM calls.</p>
 *
 * @param <U> the application's user type
 * @author Numaan Systems
 * @version 0.1.0
 */
public class OpenAmStrategy<U> {

    private static final Logger logger = LoggerFactory.getLogger(OpenAmStrategy.class);

    public static final String NAME = "openam";

    static final String PARAM_ERROR = "error";
    static final String PARAM_ERROR_DESCRIPTION = "error_description";
    static final String PARAM_CODE = "code";
    static final String PARAM_GOTO = "goto";
    static final String CODE_SUFFIX = "?code=true";

    private final StrategyConfig config;
    private final OpenAmClient client;
    private final ProfileMapper profileMapper;
    private final VerifyCallback<U> verifyCallback;
    private final Executor executor;

    /**
     * @param executor runs every stage that follows a provider call
     */
    public OpenAmStrategy(StrategyConfig config, OpenAmClient client, ProfileMapper profileMapper,
                          VerifyCallback<U> verifyCallback, Executor executor) {
        if (config == null) {
            throw new IllegalArgumentException("config is required");
        }
        if (client == null || profileMapper == null || verifyCallback == null || executor == null) {
            throw new IllegalArgumentException("client, profileMapper, verifyCallback and executor are required");
        }
        this.config = config;
        this.client = client;
        this.profileMapper = profileMapper;
        this.verifyCallback = verifyCallback;
        this.executor = executor;
    }

    public StrategyConfig getConfig() {
        return config;
    }

    /**
     * Runs the handshake and exposes the outcome as a future.
     *
     * @param request the inbound request
     * @param options per-request overrides, may be {@code null}
     * @return a future that always completes normally with exactly one outcome
     */
    public CompletableFuture<AuthOutcome<U>> authenticate(HttpServletRequest request, AuthenticateOptions options) {
        OutcomeRecorder<U> recorder = new OutcomeRecorder<>();
        authenticate(request, options, recorder);
        return recorder.outcome();
    }

    /**
     * Runs the handshake, signalling the outcome through {@code callbacks}.
     *
     * @param request the inbound request
     * @param options per-request overrides, may be {@code null}
     * @param callbacks outcome channels; exactly one is called
     */
    public void authenticate(HttpServletRequest request, AuthenticateOptions options,
                             AuthenticationCallbacks<U> callbacks) {
        AuthenticationCallbacks<U> outcome = new OnceOnlyCallbacks<>(callbacks);
        try {
            start(request, options == null ? AuthenticateOptions.defaults() : options, outcome);
        } catch (RuntimeException e) {
            logger.error("Unexpected failure while authenticating {}", request.getRequestURI(), e);
            outcome.error(e);
        }
    }

    private void start(HttpServletRequest request, AuthenticateOptions options, AuthenticationCallbacks<U> outcome) {
        String error = request.getParameter(PARAM_ERROR);
        if (hasText(error)) {
            // provider error detail is logged but not handed to the fail channel
            logger.warn("OpenAM reported an authentication error: {} ({})",
                    error, request.getParameter(PARAM_ERROR_DESCRIPTION));
            outcome.fail(null);
            return;
        }

        String callbackUrl = resolveCallbackUrl(request, options);

        if (!hasText(request.getParameter(PARAM_CODE))) {
            logger.debug("No code parameter, starting OpenAM login");
            redirectToLogin(callbackUrl, outcome);
            return;
        }

        Map<String, String> cookies = RequestSupport.parseCookies(request.getHeader("Cookie"));
        String token = cookies.get(config.getSessionCookieName());
        if (!hasText(token)) {
            logger.info("Callback without {} cookie, restarting OpenAM login", config.getSessionCookieName());
            redirectToLogin(callbackUrl, outcome);
            return;
        }

        Handshake handshake = new Handshake(request, token, callbackUrl, outcome);
        client.isTokenValid(token)
                .whenCompleteAsync((valid, failure) ->
                        runStage(handshake, () -> onTokenChecked(handshake, valid, failure)), executor);
    }

    private void onTokenChecked(Handshake handshake, Boolean valid, Throwable failure) {
        if (failure != null) {
            Throwable cause = unwrap(failure);
            logger.error("Token validation against OpenAM failed", cause);
            handshake.outcome.error(cause instanceof InternalOpenAmException
                    ? cause
                    : new InternalOpenAmException("failed to validate token", cause));
            return;
        }

        if (!Boolean.TRUE.equals(valid)) {
            logger.info("OpenAM session token {} is not valid, restarting OpenAM login", abbreviate(handshake.token));
            redirectToLogin(handshake.callbackUrl, handshake.outcome);
            return;
        }

        logger.debug("OpenAM session token {} is valid", abbreviate(handshake.token));
        loadUserProfile(handshake.token)
                .whenCompleteAsync((profile, profileFailure) ->
                        runStage(handshake, () -> onProfileLoaded(handshake, profile, profileFailure)), executor);
    }

    private void onProfileLoaded(Handshake handshake, OpenAmProfile profile, Throwable failure) {
        if (failure != null) {
            Throwable cause = unwrap(failure);
            logger.error("Could not resolve OpenAM profile", cause);
            handshake.outcome.error(cause);
            return;
        }

        AuthenticationCallbacks<U> outcome = handshake.outcome;
        try {
            verifyCallback.verify(handshake.request, handshake.token, profile, (error, user, info) -> {
                if (error != null) {
                    outcome.error(error);
                } else if (user == null) {
                    logger.info("Verify callback rejected OpenAM user {}",
                            profile != null ? profile.getUsername() : abbreviate(handshake.token));
                    outcome.fail(info);
                } else {
                    logger.info("OpenAM authentication succeeded for {}", user);
                    outcome.success(user, info);
                }
            });
        } catch (RuntimeException e) {
            logger.error("Verify callback threw", e);
            outcome.error(e);
        }
    }

    /**
     * Resolves the profile for a validated token, honoring the skip policy.
     *
     * @return a future completing with the profile, or {@code null} when skipped
     */
    CompletableFuture<OpenAmProfile> loadUserProfile(String token) {
        return config.getSkipProfilePolicy().shouldSkip(token).thenCompose(skip -> {
            if (Boolean.TRUE.equals(skip)) {
                logger.debug("Skipping OpenAM profile fetch");
                return CompletableFuture.completedFuture(null);
            }
            return userProfile(token);
        });
    }

    /**
     * Fetches attributes for the token and normalizes them.
     */
    CompletableFuture<OpenAmProfile> userProfile(String token) {
        CompletableFuture<Map<String, String>> attributes;
        try {
            attributes = client.getAttributes(token);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(new InternalOpenAmException("failed to get attributes", e));
        }

        return attributes.handleAsync((data, failure) -> {
            if (failure != null) {
                throw new InternalOpenAmException("failed to get attributes", unwrap(failure));
            }
            return profileMapper.toProfile(data);
        }, executor);
    }

    private String resolveCallbackUrl(HttpServletRequest request, AuthenticateOptions options) {
        String callbackUrl = hasText(options.getCallbackUrl()) ? options.getCallbackUrl() : config.getCallbackUrl();
        return RequestSupport.qualify(callbackUrl, request);
    }

    private void runStage(Handshake handshake, Runnable stage) {
        try {
            stage.run();
        } catch (RuntimeException e) {
            logger.error("OpenAM handshake stage failed", e);
            handshake.outcome.error(e);
        }
    }

    private void redirectToLogin(String callbackUrl, AuthenticationCallbacks<U> outcome) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put(PARAM_GOTO, callbackUrl + CODE_SUFFIX);
        String location = client.getLoginUiUrl(params);
        logger.debug("Redirecting to OpenAM login: {}", location);
        outcome.redirect(location);
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }

    private static String abbreviate(String token) {
        return token.length() <= 8 ? "***" : token.substring(0, 8) + "...";
    }

    /**
     * Per-request state handed explicitly from one stage to the next.
     */
    private final class Handshake {

        private final HttpServletRequest request;
        private final String token;
        private final String callbackUrl;
        private final AuthenticationCallbacks<U> outcome;

        private Handshake(HttpServletRequest request, String token, String callbackUrl,
                          AuthenticationCallbacks<U> outcome) {
            this.request = request;
            this.token = token;
            this.callbackUrl = callbackUrl;
            this.outcome = outcome;
        }
    }
}
