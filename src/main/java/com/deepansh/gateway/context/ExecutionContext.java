package com.deepansh.gateway.context;

import java.time.Instant;
import java.util.Optional;

/**
 * What every blocking operation runs under: the request's collaborators plus a
 * cancellation signal and an optional deadline.
 */
public interface ExecutionContext {

    RequestEnvironment environment();

    CancellationToken cancellation();

    Optional<Instant> deadline();

    default boolean isCancelled() {
        return cancellation().isCancelled();
    }

    default void throwIfCancelled() {
        cancellation().throwIfCancelled();
    }
}
