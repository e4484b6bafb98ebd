package com.numaansystems.openam.strategy;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

/**
 * Decides whether the attribute fetch is skipped for a validated token.
 *
 * <p>Whatever form the setting takes (a constant, a synchronous supplier or
 * an asynchronous decision), it is resolved once into this uniform
 * asynchronous predicate so the strategy never branches on its shape.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@FunctionalInterface
public interface SkipProfilePolicy {

    /**
     * @param token the validated session token
     * @return a future completing with {@code true} to skip the profile
     *         fetch, or exceptionally to abort the authentication
     */
    CompletableFuture<Boolean> shouldSkip(String token);

    /** Always fetch the profile. */
    static SkipProfilePolicy never() {
        return fixed(false);
    }

    /** Constant decision. */
    static SkipProfilePolicy fixed(boolean skip) {
        CompletableFuture<Boolean> decision = CompletableFuture.completedFuture(skip);
        return token -> decision;
    }

    /**
     * Synchronous decision. The supplier does not see the token.
     */
    static SkipProfilePolicy sync(BooleanSupplier supplier) {
        Objects.requireNonNull(supplier, "supplier");
        return token -> {
            try {
                return CompletableFuture.completedFuture(supplier.getAsBoolean());
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        };
    }

    /**
     * Asynchronous decision reported through a callback.
     */
    static SkipProfilePolicy async(AsyncSkipDecision decision) {
        Objects.requireNonNull(decision, "decision");
        return token -> {
            CompletableFuture<Boolean> future = new CompletableFuture<>();
            try {
                decision.decide(token, (error, skip) -> {
                    if (error != null) {
                        future.completeExceptionally(error);
                    } else {
                        future.complete(skip);
                    }
                });
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
            }
            return future;
        };
    }

    /**
     * Callback-style skip decision, for applications that look the answer up
     * somewhere asynchronous.
     */
    @FunctionalInterface
    interface AsyncSkipDecision {

        void decide(String token, Callback callback);

        @FunctionalInterface
        interface Callback {

            /**
             * @param error non-null to abort the authentication
             * @param skip whether to skip the profile fetch
             */
            void done(Throwable error, boolean skip);
        }
    }
}
