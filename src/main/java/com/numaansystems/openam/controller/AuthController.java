package com.numaansystems.openam.controller;

import com.numaansystems.openam.client.OpenAmClient;
import com.numaansystems.openam.exception.OpenAmException;
import com.numaansystems.openam.security.OpenAmAuthenticationToken;
import com.numaansystems.openam.security.OpenAmUser;
import com.numaansystems.openam.strategy.AuthOutcome;
import com.numaansystems.openam.strategy.AuthenticateOptions;
import com.numaansystems.openam.strategy.OpenAmStrategy;
import com.numaansystems.openam.strategy.StrategyConfig;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.security.web.authentication.logout.SecurityContextLogoutHandler;
import org.springframework.security.web.context.SecurityContextRepository;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Hosts the OpenAM handshake and turns each outcome into an HTTP response.
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li>{@code GET /auth/openam} - starts the handshake (redirect to OpenAM)</li>
 *   <li>{@code GET /auth/openam/callback} - completes it; success stores the
 *       authentication in the session, fail redirects to the login page</li>
 *   <li>{@code GET /auth/logout} - drops the local session and redirects to the OpenAM logout page</li>
 *   <li>{@code GET /auth/health} - status information</li>
 * </ul>
 *
 * <p>Handshake endpoints return a {@link CompletableFuture}, so the servlet
 * thread is released while OpenAM is being called.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@RestController
@RequestMapping("/auth")
public class AuthController {

    private static final Logger logger = LoggerFactory.getLogger(AuthController.class);

    private final OpenAmStrategy<OpenAmUser> strategy;
    private final OpenAmClient openAmClient;
    private final SecurityContextRepository securityContextRepository;

    @Value("${gateway.success-redirect:/}")
    private String successRedirect;

    @Value("${gateway.failure-redirect:/login}")
    private String failureRedirect;

    @Value("${gateway.allowed-redirect-domains:localhost}")
    private List<String> allowedRedirectDomains;

    public AuthController(OpenAmStrategy<OpenAmUser> strategy,
                          OpenAmClient openAmClient,
                          SecurityContextRepository securityContextRepository) {
        this.strategy = strategy;
        this.openAmClient = openAmClient;
        this.securityContextRepository = securityContextRepository;
    }

    @GetMapping("/openam")
    public CompletableFuture<ResponseEntity<Object>> initiate(HttpServletRequest request,
                                                              HttpServletResponse response) {
        logger.info("OpenAM authentication requested from {}", request.getRemoteAddr());
        return authenticate(request, response, null);
    }

    @GetMapping("/openam/callback")
    public CompletableFuture<ResponseEntity<Object>> callback(HttpServletRequest request,
                                                              HttpServletResponse response) {
        logger.info("OpenAM callback received from {}", request.getRemoteAddr());
        return authenticate(request, response, failureRedirect);
    }

    private CompletableFuture<ResponseEntity<Object>> authenticate(HttpServletRequest request,
                                                                   HttpServletResponse response,
                                                                   String failureLocation) {
        return strategy.authenticate(request, AuthenticateOptions.defaults())
                .thenApply(outcome -> toResponse(outcome, request, response, failureLocation));
    }

    private ResponseEntity<Object> toResponse(AuthOutcome<OpenAmUser> outcome,
                                              HttpServletRequest request,
                                              HttpServletResponse response,
                                              String failureLocation) {
        switch (outcome.getType()) {
            case REDIRECT:
                return redirect(outcome.getLocation());
            case SUCCESS:
                establishSession(outcome.getUser(), request, response);
                return redirect(successRedirect);
            case FAIL:
                logger.warn("OpenAM authentication failed: {}", outcome.getInfo());
                if (failureLocation != null) {
                    return redirect(failureLocation);
                }
                Map<String, Object> errorResponse = new HashMap<>();
                errorResponse.put("success", false);
                errorResponse.put("error", "Authentication failed");
                return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(errorResponse);
            default:
                Throwable cause = outcome.getCause();
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new OpenAmException("OpenAM authentication error", cause);
        }
    }

    private void establishSession(OpenAmUser user, HttpServletRequest request, HttpServletResponse response) {
        if (request.getSession(false) != null) {
            request.changeSessionId();
        }

        OpenAmAuthenticationToken authentication =
                new OpenAmAuthenticationToken(user, new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(authentication);
        securityContextRepository.saveContext(context, request, response);

        logger.info("Session established for user {} with authorities {}", user.getUsername(), user.getAuthorities());
    }

    @GetMapping("/logout")
    public void logout(@RequestParam(required = false) String returnUrl,
                       HttpServletRequest request,
                       HttpServletResponse response,
                       Authentication authentication) throws IOException {

        logger.info("Logout requested by {}", authentication != null ? authentication.getName() : "none");

        HttpSession session = request.getSession(false);
        if (session != null) {
            logger.debug("Invalidating session: {}", session.getId());
            session.invalidate();
        }

        if (authentication != null) {
            new SecurityContextLogoutHandler().logout(request, response, authentication);
        }
        SecurityContextHolder.clearContext();

        String gotoUrl = applicationRoot(request);
        if (returnUrl != null && !returnUrl.isEmpty()) {
            if (isAllowedReturnUrl(returnUrl)) {
                gotoUrl = returnUrl;
            } else {
                logger.warn("Unauthorized logout redirect attempted: {}", returnUrl);
            }
        }

        Map<String, String> params = new LinkedHashMap<>();
        params.put("goto", gotoUrl);
        String logoutUrl = openAmClient.getLogoutUiUrl(params);

        logger.info("Redirecting to OpenAM logout: {}", logoutUrl);
        response.sendRedirect(logoutUrl);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        StrategyConfig config = strategy.getConfig();

        Map<String, Object> healthInfo = new HashMap<>();
        healthInfo.put("status", "UP");
        healthInfo.put("service", "openam-sso-gateway");
        healthInfo.put("version", "0.1.0");
        healthInfo.put("strategy", OpenAmStrategy.NAME);
        healthInfo.put("realm", config.getRealm());
        healthInfo.put("cookieName", config.getSessionCookieName());

        return ResponseEntity.ok(healthInfo);
    }

    private ResponseEntity<Object> redirect(String location) {
        return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(location)).build();
    }

    /**
     * Accepts relative paths and absolute URLs whose host is an allowed
     * domain or one of its subdomains.
     */
    private boolean isAllowedReturnUrl(String returnUrl) {
        if (returnUrl.startsWith("/") && !returnUrl.startsWith("//")) {
            return true;
        }
        try {
            String host = new URL(returnUrl).getHost().toLowerCase();
            for (String allowedDomain : allowedRedirectDomains) {
                String domain = allowedDomain.toLowerCase();
                if (host.equals(domain) || host.endsWith("." + domain)) {
                    return true;
                }
            }
            return false;
        } catch (MalformedURLException e) {
            logger.warn("Malformed URL: {}", returnUrl);
            return false;
        }
    }

    private String applicationRoot(HttpServletRequest request) {
        String scheme = request.getScheme();
        int serverPort = request.getServerPort();

        String portPart = "";
        if ((scheme.equals("http") && serverPort != 80) ||
            (scheme.equals("https") && serverPort != 443)) {
            portPart = ":" + serverPort;
        }

        return scheme + "://" + request.getServerName() + portPart + request.getContextPath() + "/";
    }
}
