package com.numaansystems.openam.strategy;

import com.numaansystems.openam.profile.OpenAmProfile;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Application hook that turns a validated OpenAM session into a user.
 *
 * <p>Called exactly once per successful token validation. The profile is
 * {@code null} when the profile fetch was skipped. The implementation must
 * call {@code done} exactly once, synchronously or later.</p>
 *
 * @param <U> the application's user type
 * @author Numaan Systems
 * @version 0.1.0
 */
@FunctionalInterface
public interface VerifyCallback<U> {

    void verify(HttpServletRequest request, String token, OpenAmProfile profile, Done<U> done);

    /**
     * Continuation of a {@link VerifyCallback}.
     *
     * <ul>
     *   <li>error set &rarr; error outcome</li>
     *   <li>no user &rarr; fail outcome with {@code info}</li>
     *   <li>user &rarr; success outcome</li>
     * </ul>
     */
    @FunctionalInterface
    interface Done<U> {

        void done(Throwable error, U user, Object info);

        default void success(U user, Object info) {
            done(null, user, info);
        }

        default void fail(Object info) {
            done(null, null, info);
        }

        default void error(Throwable error) {
            done(error, null, null);
        }
    }
}
