package com.numaansystems.openam.service;

import com.numaansystems.openam.profile.OpenAmProfile;
import com.numaansystems.openam.security.OpenAmUser;
import com.numaansystems.openam.strategy.VerifyCallback;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Default verify step: the OpenAM profile itself becomes the user.
 *
 * <h2>Authority Merging</h2>
 * <ul>
 *   <li>{@code ROLE_USER} for every authenticated user</li>
 *   <li>authorities from an optional {@link UserAuthorityService}</li>
 * </ul>
 *
 * <p>A profile without {@code uid} is rejected. When the profile fetch was
 * skipped the user is named after the OpenAM session.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Component
public class ProfileVerifyCallback implements VerifyCallback<OpenAmUser> {

    private static final Logger logger = LoggerFactory.getLogger(ProfileVerifyCallback.class);

    static final String DEFAULT_ROLE = "ROLE_USER";
    static final String MISSING_UID = "missing uid";

    private final ObjectProvider<UserAuthorityService> userAuthorityService;

    public ProfileVerifyCallback(ObjectProvider<UserAuthorityService> userAuthorityService) {
        this.userAuthorityService = userAuthorityService;
    }

    @Override
    public void verify(HttpServletRequest request, String token, OpenAmProfile profile, Done<OpenAmUser> done) {
        Set<String> authorities = new LinkedHashSet<>();
        authorities.add(DEFAULT_ROLE);

        if (profile == null) {
            String sessionName = "openam-session-" + Integer.toHexString(token.hashCode());
            logger.info("No OpenAM profile loaded, authenticating session user {}", sessionName);
            done.success(new OpenAmUser(sessionName, null, authorities), null);
            return;
        }

        String username = profile.getUsername();
        if (username == null || username.isEmpty()) {
            logger.warn("OpenAM profile has no uid attribute, rejecting");
            done.fail(MISSING_UID);
            return;
        }

        UserAuthorityService authorityService = userAuthorityService.getIfAvailable();
        if (authorityService != null) {
            try {
                Collection<String> extra = authorityService.loadAuthoritiesByUsername(username);
                authorities.addAll(extra);
                logger.info("Added {} application authorities for user {}", extra.size(), username);
            } catch (Exception e) {
                logger.warn("Failed to load application authorities for user {}: {}", username, e.getMessage());
            }
        }

        done.success(new OpenAmUser(username, profile, authorities), null);
    }
}
