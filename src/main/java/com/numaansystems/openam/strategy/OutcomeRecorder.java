package com.numaansystems.openam.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * {@link AuthenticationCallbacks} that turns the first signal into a
 * completed {@link AuthOutcome} future. Later signals are dropped and logged.
 *
 * @param <U> the application's user type
 */
public class OutcomeRecorder<U> implements AuthenticationCallbacks<U> {

    private static final Logger logger = LoggerFactory.getLogger(OutcomeRecorder.class);

    private final CompletableFuture<AuthOutcome<U>> outcome = new CompletableFuture<>();

    public CompletableFuture<AuthOutcome<U>> outcome() {
        return outcome;
    }

    @Override
    public void redirect(String location) {
        record(AuthOutcome.redirect(location));
    }

    @Override
    public void success(U user, Object info) {
        record(AuthOutcome.success(user, info));
    }

    @Override
    public void fail(Object info) {
        record(AuthOutcome.fail(info));
    }

    @Override
    public void error(Throwable cause) {
        record(AuthOutcome.error(cause));
    }

    private void record(AuthOutcome<U> result) {
        if (!outcome.complete(result)) {
            logger.warn("Ignoring {} - outcome already recorded", result);
        }
    }
}
