package com.numaansystems.openam.service;

import com.numaansystems.openam.profile.OpenAmProfile;
import com.numaansystems.openam.security.OpenAmUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mock.web.MockHttpServletRequest;

import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ProfileVerifyCallback.
 *
 * <p>Tests user creation from the OpenAM profile and merging of
 * application authorities.</p>
 */
@ExtendWith(MockitoExtension.class)
class ProfileVerifyCallbackTest {

    @Mock
    private ObjectProvider<UserAuthorityService> userAuthorityServiceProvider;

    @Mock
    private UserAuthorityService userAuthorityService;

    private ProfileVerifyCallback verifyCallback;

    private Throwable reportedError;
    private OpenAmUser reportedUser;
    private Object reportedInfo;
    private int calls;

    @BeforeEach
    void setUp() {
        verifyCallback = new ProfileVerifyCallback(userAuthorityServiceProvider);
    }

    private void verifyProfile(String token, OpenAmProfile profile) {
        verifyCallback.verify(new MockHttpServletRequest(), token, profile, (error, user, info) -> {
            calls++;
            reportedError = error;
            reportedUser = user;
            reportedInfo = info;
        });
    }

    private static OpenAmProfile profile(String uid) {
        return new OpenAmProfile("t1", uid, "Bob Smith", new OpenAmProfile.Name("Smith", "Bob"), "bob@x.com",
                Map.of("uid", uid == null ? "" : uid));
    }

    @Test
    @DisplayName("Should accept the profile as user with ROLE_USER when no authority service is present")
    void testAcceptProfile() {
        // Arrange
        when(userAuthorityServiceProvider.getIfAvailable()).thenReturn(null);

        // Act
        verifyProfile("tok123", profile("bob"));

        // Assert
        assertEquals(1, calls);
        assertNull(reportedError);
        assertNotNull(reportedUser);
        assertEquals("bob", reportedUser.getUsername());
        assertEquals("bob@x.com", reportedUser.getEmail());
        assertEquals("Bob Smith", reportedUser.getDisplayName());
        assertTrue(reportedUser.getAuthorities().contains("ROLE_USER"));
        assertEquals(1, reportedUser.getAuthorities().size());
    }

    @Test
    @DisplayName("Should merge application authorities into the user")
    void testMergeAuthorities() {
        // Arrange
        when(userAuthorityServiceProvider.getIfAvailable()).thenReturn(userAuthorityService);
        when(userAuthorityService.loadAuthoritiesByUsername("bob"))
                .thenReturn(Arrays.asList("ROLE_ADMIN", "PERM_READ", "ROLE_USER"));

        // Act
        verifyProfile("tok123", profile("bob"));

        // Assert
        assertNotNull(reportedUser);
        assertEquals(3, reportedUser.getAuthorities().size(), "Duplicate authorities are collapsed");
        assertTrue(reportedUser.getAuthorities().contains("ROLE_ADMIN"));
        assertTrue(reportedUser.getAuthorities().contains("PERM_READ"));
        verify(userAuthorityService, times(1)).loadAuthoritiesByUsername("bob");
    }

    @Test
    @DisplayName("Should still succeed when the authority lookup fails")
    void testAuthorityLookupFailure() {
        // Arrange
        when(userAuthorityServiceProvider.getIfAvailable()).thenReturn(userAuthorityService);
        when(userAuthorityService.loadAuthoritiesByUsername(anyString()))
                .thenThrow(new IllegalStateException("Database error"));

        // Act
        verifyProfile("tok123", profile("bob"));

        // Assert
        assertNull(reportedError);
        assertNotNull(reportedUser);
        assertEquals(1, reportedUser.getAuthorities().size());
    }

    @Test
    @DisplayName("Should reject a profile without uid")
    void testMissingUid() {
        // Act
        verifyProfile("tok123", profile(""));

        // Assert
        assertEquals(1, calls);
        assertNull(reportedUser);
        assertEquals("missing uid", reportedInfo);
        verifyNoInteractions(userAuthorityServiceProvider);
    }

    @Test
    @DisplayName("Should name the user after the session when the profile was skipped")
    void testSkippedProfile() {
        // Act
        verifyProfile("AQIC5wM2LY4Sfcx", null);

        // Assert
        assertNotNull(reportedUser);
        assertTrue(reportedUser.getUsername().startsWith("openam-session-"));
        assertNull(reportedUser.getProfile());
        assertNull(reportedUser.getEmail());
        assertEquals(reportedUser.getUsername(), reportedUser.getDisplayName());
        assertEquals(1, reportedUser.getAuthorities().size());
        verifyNoInteractions(userAuthorityServiceProvider);
    }
}
