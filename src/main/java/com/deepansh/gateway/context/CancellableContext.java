package com.deepansh.gateway.context;

import java.time.Instant;
import java.util.Optional;

/**
 * Plain context with its own token. A child created with {@link #withCancel} is
 * cancelled when its parent is, and shares the parent's environment and deadline.
 */
public class CancellableContext implements ExecutionContext, AutoCloseable {

    private final RequestEnvironment environment;
    private final CancellationToken token;
    private final Instant deadline;

    private CancellableContext(RequestEnvironment environment, CancellationToken token, Instant deadline) {
        this.environment = environment;
        this.token = token;
        this.deadline = deadline;
    }

    public static CancellableContext background() {
        return of(RequestEnvironment.empty());
    }

    public static CancellableContext of(RequestEnvironment environment) {
        return new CancellableContext(environment, new CancellationToken(), null);
    }

    public static CancellableContext withCancel(ExecutionContext parent) {
        return new CancellableContext(parent.environment(), parent.cancellation().child(),
                parent.deadline().orElse(null));
    }

    public boolean cancel() {
        return token.cancel();
    }

    @Override
    public RequestEnvironment environment() {
        return environment;
    }

    @Override
    public CancellationToken cancellation() {
        return token;
    }

    @Override
    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    @Override
    public void close() {
        token.cancel();
    }
}
