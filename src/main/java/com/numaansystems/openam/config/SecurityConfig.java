package com.numaansystems.openam.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.LoginUrlAuthenticationEntryPoint;
import org.springframework.security.web.context.HttpSessionSecurityContextRepository;
import org.springframework.security.web.context.SecurityContextRepository;

/**
 * Security configuration for the gateway.
 *
 * <p>The OpenAM handshake endpoints are public; {@code /account} and the
 * API documentation need an authenticated session. Unauthenticated
 * requests to protected paths are redirected to {@code /login}.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    /**
     * Configures the security filter chain with CORS support and authorization rules.
     *
     * @param http the HttpSecurity to configure
     * @param securityContextRepository where authenticated sessions are kept
     * @return the configured SecurityFilterChain
     * @throws Exception if an error occurs during configuration
     */
    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http,
                                                   SecurityContextRepository securityContextRepository) throws Exception {
        http
            .cors(Customizer.withDefaults())
            .securityContext(context -> context.securityContextRepository(securityContextRepository))
            .authorizeHttpRequests(authorize -> authorize
                .requestMatchers("/account", "/account/**").authenticated()
                .requestMatchers("/swagger-ui/**", "/api-docs/**", "/v3/api-docs/**").authenticated()
                .anyRequest().permitAll()
            )
            .exceptionHandling(exceptions -> exceptions
                .authenticationEntryPoint(new LoginUrlAuthenticationEntryPoint("/login"))
            )
            .logout(logout -> logout.disable())
            .csrf(csrf -> csrf.disable());

        return http.build();
    }

    /**
     * Session-backed store for the security context established by the OpenAM callback.
     */
    @Bean
    public SecurityContextRepository securityContextRepository() {
        return new HttpSessionSecurityContextRepository();
    }
}
