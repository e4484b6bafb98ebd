package com.numaansystems.openam;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.numaansystems.openam.service.UserAuthorityService;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end handshake against a WireMock OpenAM.
 *
 * <p>Runs the full Spring Security chain: the login redirect, the callback
 * with the OpenAM session cookie, and the protected {@code /account}
 * page with the resulting session.</p>
 */
@SpringBootTest
@AutoConfigureMockMvc
class OpenAmHandshakeIntegrationTest {

    private static final String TOKEN = "AQIC5wM2LY4Sfcx-tok123";

    private static final WireMockServer wireMockServer = new WireMockServer(options().dynamicPort());

    static {
        wireMockServer.start();
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private UserAuthorityService userAuthorityService;

    @DynamicPropertySource
    static void openAmProperties(DynamicPropertyRegistry registry) {
        registry.add("openam.base-url", () -> wireMockServer.baseUrl() + "/openam/");
    }

    @AfterAll
    static void stopOpenAm() {
        wireMockServer.stop();
    }

    @BeforeEach
    void resetStubs() {
        wireMockServer.resetAll();
    }

    private void stubValidToken() {
        wireMockServer.stubFor(post(urlEqualTo("/openam/identity/isTokenValid"))
                .withRequestBody(containing("tokenid=" + TOKEN))
                .willReturn(aResponse().withStatus(200).withBody("boolean=true")));
    }

    @Test
    @DisplayName("Should send unauthenticated visitors of protected pages to the login page")
    void testProtectedPageRedirect() throws Exception {
        mockMvc.perform(get("/account"))
                .andExpect(status().is3xxRedirection())
                .andExpect(redirectedUrlPattern("**/login"));
    }

    @Test
    @DisplayName("Should redirect to OpenAM with the callback URL as goto")
    void testLoginRedirect() throws Exception {
        // Act
        MvcResult result = mockMvc.perform(get("/auth/openam"))
                .andExpect(request().asyncStarted())
                .andReturn();

        // Assert
        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isFound())
                .andExpect(redirectedUrl(wireMockServer.baseUrl()
                        + "/openam/UI/Login?goto=http%3A%2F%2Fapp.test%2Fauth%2Fopenam%2Fcallback%3Fcode%3Dtrue"));
    }

    @Test
    @DisplayName("Should complete the handshake and open the account page with the new session")
    void testFullHandshake() throws Exception {
        // Arrange
        stubValidToken();
        wireMockServer.stubFor(post(urlEqualTo("/openam/identity/attributes"))
                .willReturn(aResponse().withStatus(200).withBody(String.join("\n",
                        "userdetails.token.id=t1",
                        "userdetails.attribute.name=uid",
                        "userdetails.attribute.value=bob",
                        "userdetails.attribute.name=cn",
                        "userdetails.attribute.value=Bob Smith",
                        "userdetails.attribute.name=mail",
                        "userdetails.attribute.value=bob@x.com"))));
        AtomicReference<String> lookupThread = new AtomicReference<>();
        when(userAuthorityService.loadAuthoritiesByUsername("bob")).thenAnswer(invocation -> {
            lookupThread.set(Thread.currentThread().getName());
            return List.of("ROLE_AUDITOR");
        });

        // Act
        MvcResult result = mockMvc.perform(get("/auth/openam/callback")
                        .param("code", "true")
                        .cookie(new Cookie("iPlanetDirectoryPro", TOKEN)))
                .andExpect(request().asyncStarted())
                .andReturn();
        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isFound())
                .andExpect(redirectedUrl("/"));

        // Assert
        MockHttpSession session = (MockHttpSession) result.getRequest().getSession(false);
        assertNotNull(session, "Handshake should create a session");

        mockMvc.perform(get("/account").session(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value("bob"))
                .andExpect(jsonPath("$.email").value("bob@x.com"))
                .andExpect(jsonPath("$.displayName").value("Bob Smith"))
                .andExpect(jsonPath("$.authorities[1].authority").value("ROLE_AUDITOR"));

        assertNotNull(lookupThread.get());
        assertTrue(lookupThread.get().startsWith("openam-handshake-"),
                "Authority lookup ran on " + lookupThread.get());

        wireMockServer.verify(1, postRequestedFor(urlEqualTo("/openam/identity/isTokenValid")));
        wireMockServer.verify(1, postRequestedFor(urlEqualTo("/openam/identity/attributes")));
    }

    @Test
    @DisplayName("Should restart the login when OpenAM rejects the session token")
    void testInvalidToken() throws Exception {
        // Arrange
        wireMockServer.stubFor(post(urlEqualTo("/openam/identity/isTokenValid"))
                .willReturn(aResponse().withStatus(200).withBody("boolean=false")));

        // Act
        MvcResult result = mockMvc.perform(get("/auth/openam/callback")
                        .param("code", "true")
                        .cookie(new Cookie("iPlanetDirectoryPro", TOKEN)))
                .andExpect(request().asyncStarted())
                .andReturn();

        // Assert
        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isFound())
                .andExpect(header().string("Location", startsWith(wireMockServer.baseUrl() + "/openam/UI/Login?goto=")));
        wireMockServer.verify(0, postRequestedFor(urlEqualTo("/openam/identity/attributes")));
    }

    @Test
    @DisplayName("Should answer 502 when the OpenAM attributes call fails")
    void testAttributesUnavailable() throws Exception {
        // Arrange
        stubValidToken();
        wireMockServer.stubFor(post(urlEqualTo("/openam/identity/attributes"))
                .willReturn(aResponse().withStatus(503)));

        // Act
        MvcResult result = mockMvc.perform(get("/auth/openam/callback")
                        .param("code", "true")
                        .cookie(new Cookie("iPlanetDirectoryPro", TOKEN)))
                .andExpect(request().asyncStarted())
                .andReturn();

        // Assert
        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("failed to get attributes"));
    }
}
