package com.numaansystems.openam.controller;

import com.numaansystems.openam.profile.OpenAmProfile;
import com.numaansystems.openam.security.OpenAmUser;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Small demo surface around the OpenAM login.
 *
 * <p>{@code /} and {@code /login} are public; {@code /account} requires a
 * session established through {@code /auth/openam/callback}.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@RestController
public class AccountController {

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> index(Authentication authentication) {
        Map<String, Object> response = new HashMap<>();
        response.put("endpoint", "/");
        response.put("authenticated", isOpenAmUser(authentication));
        if (isOpenAmUser(authentication)) {
            response.put("username", authentication.getName());
        }
        return ResponseEntity.ok(response);
    }

    @GetMapping("/login")
    public ResponseEntity<Map<String, Object>> login() {
        Map<String, Object> response = new HashMap<>();
        response.put("endpoint", "/login");
        response.put("message", "Sign in with OpenAM");
        response.put("loginUrl", "/auth/openam");
        return ResponseEntity.ok(response);
    }

    /**
     * Returns the signed-in user and the profile OpenAM reported for them.
     *
     * @param authentication the current authentication object
     * @return JSON response with user information
     */
    @GetMapping("/account")
    public ResponseEntity<Map<String, Object>> account(Authentication authentication) {
        Map<String, Object> response = new HashMap<>();
        response.put("username", authentication.getName());
        response.put("authorities", authentication.getAuthorities());

        if (authentication.getPrincipal() instanceof OpenAmUser user && user.getProfile() != null) {
            OpenAmProfile profile = user.getProfile();
            response.put("id", profile.getId());
            response.put("displayName", profile.getDisplayName());
            response.put("email", profile.getEmail());
            response.put("familyName", profile.getName().getFamilyName());
            response.put("givenName", profile.getName().getGivenName());
        }

        return ResponseEntity.ok(response);
    }

    private static boolean isOpenAmUser(Authentication authentication) {
        return authentication != null
                && authentication.isAuthenticated()
                && authentication.getPrincipal() instanceof OpenAmUser;
    }
}
