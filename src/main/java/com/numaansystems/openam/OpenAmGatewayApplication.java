package com.numaansystems.openam;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * OpenAM SSO Gateway Application
 *
 * <p>Spring Boot application that signs users in against an OpenAM
 * access-management server using OpenAM's session cookie
 * ({@code iPlanetDirectoryPro} by default).</p>
 *
 * <h2>Flow</h2>
 * <ol>
 *   <li>Browser hits /auth/openam and is redirected to the OpenAM login page</li>
 *   <li>OpenAM authenticates the user and sets its session cookie</li>
 *   <li>OpenAM sends the browser to /auth/openam/callback?code=true</li>
 *   <li>Gateway validates the session token against OpenAM</li>
 *   <li>Gateway fetches the user's attributes and normalizes them into a profile</li>
 *   <li>Verify callback turns the profile into an application user</li>
 *   <li>Gateway stores the authentication in its own HTTP session</li>
 * </ol>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@SpringBootApplication
public class OpenAmGatewayApplication {

    /**
     * Main entry point for the OpenAM SSO Gateway.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(OpenAmGatewayApplication.class, args);
    }
}
