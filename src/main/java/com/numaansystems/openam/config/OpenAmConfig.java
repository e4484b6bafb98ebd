package com.numaansystems.openam.config;

import com.numaansystems.openam.client.HttpOpenAmClient;
import com.numaansystems.openam.client.OpenAmClient;
import com.numaansystems.openam.profile.ProfileMapper;
import com.numaansystems.openam.security.OpenAmUser;
import com.numaansystems.openam.strategy.OpenAmStrategy;
import com.numaansystems.openam.strategy.SkipProfilePolicy;
import com.numaansystems.openam.strategy.StrategyConfig;
import com.numaansystems.openam.strategy.VerifyCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Wires the OpenAM strategy and its collaborators from {@link OpenAmProperties}.
 *
 * <p>The strategy configuration is validated here, so a missing base URL or
 * callback URL stops the application context from starting.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Configuration
@EnableConfigurationProperties(OpenAmProperties.class)
public class OpenAmConfig {

    private static final Logger logger = LoggerFactory.getLogger(OpenAmConfig.class);

    @Bean
    public StrategyConfig strategyConfig(OpenAmProperties properties) {
        StrategyConfig config = StrategyConfig.builder()
                .identityProviderBaseUrl(properties.getBaseUrl())
                .callbackUrl(properties.getCallbackUrl())
                .realm(properties.getRealm())
                .sessionCookieName(properties.getCookieName())
                .skipProfilePolicy(SkipProfilePolicy.fixed(properties.isSkipUserProfile()))
                .showLoginPage(properties.isLoginPage())
                .build();

        logger.info("OpenAM strategy configured: {}", config);
        logger.info("Skip user profile: {}", properties.isSkipUserProfile());
        return config;
    }

    @Bean
    public HttpOpenAmClient openAmClient(StrategyConfig strategyConfig, OpenAmProperties properties) {
        return new HttpOpenAmClient(
                strategyConfig.getIdentityProviderBaseUrl(),
                strategyConfig.getRealm(),
                HttpOpenAmClient.ConnectionSettings.builder()
                        .connectTimeout(properties.getConnectTimeout())
                        .responseTimeout(properties.getResponseTimeout())
                        .connectionRequestTimeout(properties.getConnectionRequestTimeout())
                        .maxConnections(properties.getMaxConnections())
                        .maxConnectionsPerRoute(properties.getMaxConnectionsPerRoute())
                        .build());
    }

    /**
     * Runs handshake stages after OpenAM has answered, keeping verify
     * callbacks and authority lookups off the HTTP client's I/O threads.
     */
    @Bean
    public ThreadPoolTaskExecutor openAmHandshakeExecutor(OpenAmProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getHandshakePoolSize());
        executor.setMaxPoolSize(properties.getHandshakePoolSize());
        executor.setThreadNamePrefix("openam-handshake-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        logger.info("OpenAM handshake executor: {} threads", properties.getHandshakePoolSize());
        return executor;
    }

    @Bean
    public ProfileMapper profileMapper() {
        return new ProfileMapper();
    }

    @Bean
    public OpenAmStrategy<OpenAmUser> openAmStrategy(StrategyConfig strategyConfig,
                                                    OpenAmClient openAmClient,
                                                    ProfileMapper profileMapper,
                                                    VerifyCallback<OpenAmUser> verifyCallback,
                                                    ThreadPoolTaskExecutor openAmHandshakeExecutor) {
        return new OpenAmStrategy<>(strategyConfig, openAmClient, profileMapper, verifyCallback,
                openAmHandshakeExecutor);
    }
}
