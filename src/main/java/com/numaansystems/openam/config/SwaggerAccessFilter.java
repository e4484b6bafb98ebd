package com.numaansystems.openam.config;

import com.numaansystems.openam.security.OpenAmUser;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Servlet filter to restrict Swagger UI access to specific configured users.
 *
 * <p>Matches the OpenAM {@code mail} attribute of the signed-in user, or
 * the {@code uid} when no mail is known, against the allowed-users list.</p>
 *
 * <h2>Configuration</h2>
 * <pre>
 * gateway:
 *   swagger:
 *     enabled: true
 *     allowed-users:
 *       - admin@numaansystems.com
 * </pre>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
public class SwaggerAccessFilter implements Filter {

    private static final Logger logger = LoggerFactory.getLogger(SwaggerAccessFilter.class);

    @Value("${gateway.swagger.enabled:true}")
    private boolean swaggerEnabled;

    @Value("${gateway.swagger.allowed-users:}")
    private List<String> allowedUsers;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;
        String requestURI = httpRequest.getRequestURI();

        if (requestURI.contains("/swagger-ui") || requestURI.contains("/api-docs")) {

            if (!swaggerEnabled) {
                logger.warn("Swagger access denied: Swagger is disabled");
                httpResponse.sendError(HttpServletResponse.SC_FORBIDDEN, "Swagger UI is disabled");
                return;
            }

            Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

            if (authentication == null || !authentication.isAuthenticated()) {
                logger.warn("Swagger access denied: User not authenticated");
                httpResponse.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Authentication required for Swagger UI");
                return;
            }

            String userId = null;
            if (authentication.getPrincipal() instanceof OpenAmUser user) {
                userId = user.getEmail() != null ? user.getEmail() : user.getUsername();
            }

            if (userId == null || !allowedUsers.contains(userId)) {
                logger.warn("Swagger access denied for user: {}", userId);
                httpResponse.sendError(HttpServletResponse.SC_FORBIDDEN, "Access to Swagger UI is restricted");
                return;
            }

            logger.info("Swagger access granted to user: {}", userId);
        }

        chain.doFilter(request, response);
    }
}
