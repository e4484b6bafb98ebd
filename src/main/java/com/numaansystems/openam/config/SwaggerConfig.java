package com.numaansystems.openam.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Swagger/OpenAPI configuration for API documentation.
 *
 * <h2>Access</h2>
 * <ul>
 *   <li>Swagger UI: /swagger-ui.html</li>
 *   <li>OpenAPI JSON: /api-docs</li>
 * </ul>
 *
 * <p>Access is limited to the users listed in
 * {@code gateway.swagger.allowed-users}, see {@link SwaggerAccessFilter}.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI gatewayOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("OpenAM SSO Gateway API")
                .description("Single sign-on against OpenAM using the iPlanetDirectoryPro session cookie")
                .version("0.1.0")
                .contact(new Contact()
                    .name("Numaan Systems")
                    .email("support@numaansystems.com"))
                .license(new License()
                    .name("MIT License")
                    .url("https://opensource.org/licenses/MIT")));
    }
}
