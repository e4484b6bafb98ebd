package com.numaansystems.openam.strategy;

/**
 * Outcome channels the host hands to each {@link OpenAmStrategy} invocation.
 *
 * <p>Exactly one method is called per invocation.</p>
 *
 * @param <U> the application's user type
 * @author Numaan Systems
 * @version 0.1.0
 */
public interface AuthenticationCallbacks<U> {

    /** The browser must be redirected to {@code location}. */
    void redirect(String location);

    /** Authentication succeeded. {@code info} carries optional metadata. */
    void success(U user, Object info);

    /** Authentication was rejected. {@code info} may be {@code null}. */
    void fail(Object info);

    /** Authentication could not complete; the host should answer with a 5xx. */
    void error(Throwable cause);
}
