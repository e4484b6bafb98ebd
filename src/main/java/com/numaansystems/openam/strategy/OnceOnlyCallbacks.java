package com.numaansystems.openam.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Guards host callbacks so at most one outcome is ever delivered.
 */
final class OnceOnlyCallbacks<U> implements AuthenticationCallbacks<U> {

    private static final Logger logger = LoggerFactory.getLogger(OnceOnlyCallbacks.class);

    private final AuthenticationCallbacks<U> delegate;
    private final AtomicBoolean signalled = new AtomicBoolean();

    OnceOnlyCallbacks(AuthenticationCallbacks<U> delegate) {
        this.delegate = delegate;
    }

    @Override
    public void redirect(String location) {
        if (claim("redirect")) {
            delegate.redirect(location);
        }
    }

    @Override
    public void success(U user, Object info) {
        if (claim("success")) {
            delegate.success(user, info);
        }
    }

    @Override
    public void fail(Object info) {
        if (claim("fail")) {
            delegate.fail(info);
        }
    }

    @Override
    public void error(Throwable cause) {
        if (claim("error")) {
            delegate.error(cause);
        } else {
            logger.debug("Late error after outcome was delivered", cause);
        }
    }

    private boolean claim(String channel) {
        if (signalled.compareAndSet(false, true)) {
            return true;
        }
        logger.warn("Dropping second outcome '{}' for the same request", channel);
        return false;
    }
}
