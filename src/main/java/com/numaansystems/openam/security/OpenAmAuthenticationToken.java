package com.numaansystems.openam.security;

import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.stream.Collectors;

/**
 * Spring Security authentication for a user whose OpenAM session was validated.
 *
 * <p>The OpenAM session token is not kept as credentials;
 * OpenAM remains the owner of that session.</p>
 */
public class OpenAmAuthenticationToken extends AbstractAuthenticationToken {

    private static final long serialVersionUID = 1L;

    private final OpenAmUser user;

    public OpenAmAuthenticationToken(OpenAmUser user, Object details) {
        super(user.getAuthorities().stream()
                .map(SimpleGrantedAuthority::new)
                .collect(Collectors.toList()));
        this.user = user;
        setDetails(details);
        setAuthenticated(true);
    }

    @Override
    public Object getCredentials() {
        return null;
    }

    @Override
    public OpenAmUser getPrincipal() {
        return user;
    }

    @Override
    public String getName() {
        return user.getUsername();
    }
}
