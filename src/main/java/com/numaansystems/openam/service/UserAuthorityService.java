package com.numaansystems.openam.service;

import java.util.Collection;

/**
 * Optional source of application authorities for OpenAM users.
 *
 * <p>When a bean of this type exists, {@link ProfileVerifyCallback} merges
 * its authorities with the default {@code ROLE_USER}. The gateway works
 * without one.</p>
 *
 * <h2>Injection</h2>
 * <p>Injected as an {@code ObjectProvider}, so the application starts
 * whether or not an implementation is available.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public interface UserAuthorityService {

    /**
     * Loads authorities for a user.
     *
     * @param username the OpenAM {@code uid}
     * @return authority strings such as {@code ROLE_ADMIN}, empty if none
     * @throws RuntimeException on lookup failure (caught and logged by the caller)
     */
    Collection<String> loadAuthoritiesByUsername(String username);
}
