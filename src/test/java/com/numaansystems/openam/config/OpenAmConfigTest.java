package com.numaansystems.openam.config;

import com.numaansystems.openam.client.OpenAmClient;
import com.numaansystems.openam.exception.OpenAmConfigurationException;
import com.numaansystems.openam.service.ProfileVerifyCallback;
import com.numaansystems.openam.strategy.OpenAmStrategy;
import com.numaansystems.openam.strategy.StrategyConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the OpenAM bean wiring and property binding.
 */
class OpenAmConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(OpenAmConfig.class, ProfileVerifyCallback.class);

    @Test
    @DisplayName("Should bind openam properties into the strategy configuration")
    void testPropertyBinding() {
        contextRunner
                .withPropertyValues(
                        "openam.base-url=https://sso.example.com/openam",
                        "openam.callback-url=https://app.example.com/auth/openam/callback",
                        "openam.realm=/employees",
                        "openam.cookie-name=amSession",
                        "openam.skip-user-profile=true",
                        "openam.response-timeout=3s",
                        "openam.connection-request-timeout=2s",
                        "openam.max-connections=30",
                        "openam.max-connections-per-route=10",
                        "openam.handshake-pool-size=4")
                .run(context -> {
                    assertNull(context.getStartupFailure());

                    OpenAmProperties properties = context.getBean(OpenAmProperties.class);
                    assertEquals(2, properties.getConnectionRequestTimeout().getSeconds());
                    assertEquals(30, properties.getMaxConnections());
                    assertEquals(10, properties.getMaxConnectionsPerRoute());

                    ThreadPoolTaskExecutor executor = context.getBean(ThreadPoolTaskExecutor.class);
                    assertEquals(4, executor.getMaxPoolSize());
                    assertEquals("openam-handshake-", executor.getThreadNamePrefix());

                    StrategyConfig config = context.getBean(StrategyConfig.class);
                    assertEquals("https://sso.example.com/openam", config.getIdentityProviderBaseUrl());
                    assertEquals("/employees", config.getRealm());
                    assertEquals("amSession", config.getSessionCookieName());
                    assertTrue(config.getSkipProfilePolicy().shouldSkip("t").get(1, TimeUnit.SECONDS));

                    assertEquals(3, context.getBean(OpenAmProperties.class).getResponseTimeout().getSeconds());
                    assertNotNull(context.getBean(OpenAmClient.class));
                    assertNotNull(context.getBean(OpenAmStrategy.class));
                });
    }

    @Test
    @DisplayName("Should apply defaults for optional openam properties")
    void testDefaults() {
        contextRunner
                .withPropertyValues(
                        "openam.base-url=https://sso.example.com/openam/",
                        "openam.callback-url=/auth/openam/callback")
                .run(context -> {
                    StrategyConfig config = context.getBean(StrategyConfig.class);
                    assertEquals("/", config.getRealm());
                    assertEquals("iPlanetDirectoryPro", config.getSessionCookieName());
                    assertFalse(config.getSkipProfilePolicy().shouldSkip("t").get(1, TimeUnit.SECONDS));
                    assertTrue(config.isShowLoginPage());
                });
    }

    @Test
    @DisplayName("Should refuse to start without an OpenAM base URL")
    void testMissingBaseUrl() {
        contextRunner
                .withPropertyValues("openam.callback-url=https://app.example.com/auth/openam/callback")
                .run(context -> {
                    assertNotNull(context.getStartupFailure());
                    Throwable cause = NestedExceptionUtils.getMostSpecificCause(context.getStartupFailure());
                    assertInstanceOf(OpenAmConfigurationException.class, cause);
                    assertEquals("OpenAmStrategy requires an openAmBaseUrl option", cause.getMessage());
                });
    }

    @Test
    @DisplayName("Should refuse to start without a callback URL")
    void testMissingCallbackUrl() {
        contextRunner
                .withPropertyValues("openam.base-url=https://sso.example.com/openam/")
                .run(context -> {
                    assertNotNull(context.getStartupFailure());
                    Throwable cause = NestedExceptionUtils.getMostSpecificCause(context.getStartupFailure());
                    assertInstanceOf(OpenAmConfigurationException.class, cause);
                });
    }

    @Test
    @DisplayName("Should refuse to start with a malformed callback URL")
    void testMalformedCallbackUrl() {
        contextRunner
                .withPropertyValues(
                        "openam.base-url=https://sso.example.com/openam/",
                        "openam.callback-url=https://app.example.com/auth openam/callback")
                .run(context -> {
                    assertNotNull(context.getStartupFailure());
                    assertTrue(hasCause(context.getStartupFailure(), OpenAmConfigurationException.class));
                });
    }

    private static boolean hasCause(Throwable failure, Class<? extends Throwable> type) {
        for (Throwable current = failure; current != null; current = current.getCause()) {
            if (type.isInstance(current)) {
                return true;
            }
        }
        return false;
    }
}
