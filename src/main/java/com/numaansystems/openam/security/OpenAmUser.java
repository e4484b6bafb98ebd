package com.numaansystems.openam.security;

import com.numaansystems.openam.profile.OpenAmProfile;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Application user produced by a successful OpenAM handshake.
 *
 * <p>Stored in the HTTP session as the principal of an
 * {@link OpenAmAuthenticationToken}. The profile is {@code null} when the
 * profile fetch was skipped.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class OpenAmUser implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String username;
    private final OpenAmProfile profile;
    private final Set<String> authorities;

    public OpenAmUser(String username, OpenAmProfile profile, Set<String> authorities) {
        this.username = username;
        this.profile = profile;
        this.authorities = Collections.unmodifiableSet(new LinkedHashSet<>(authorities));
    }

    public String getUsername() {
        return username;
    }

    public OpenAmProfile getProfile() {
        return profile;
    }

    public String getEmail() {
        return profile != null ? profile.getEmail() : null;
    }

    public String getDisplayName() {
        return profile != null ? profile.getDisplayName() : username;
    }

    public Set<String> getAuthorities() {
        return authorities;
    }

    @Override
    public String toString() {
        return username;
    }
}
