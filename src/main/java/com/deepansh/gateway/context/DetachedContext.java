package com.deepansh.gateway.context;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Context for work that must outlive whoever started it.
 *
 * The environment still comes from the parent, so tool providers and observers
 * attached to the original request stay reachable. Cancellation and deadline come
 * from an independent token with its own timeout: cancelling the parent has no effect.
 * Always {@link #close()} it, otherwise the timeout task stays scheduled.
 */
public class DetachedContext implements ExecutionContext, AutoCloseable {

    private static final ScheduledExecutorService SHARED_TIMER = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "detached-context-timer");
        t.setDaemon(true);
        return t;
    });

    private final ExecutionContext parent;
    private final CancellationToken token = new CancellationToken();
    private final Instant deadline;
    private final ScheduledFuture<?> timer;

    private DetachedContext(ExecutionContext parent, Duration timeout, ScheduledExecutorService scheduler, Clock clock) {
        this.parent = parent;
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            this.deadline = null;
            this.timer = null;
        } else {
            this.deadline = clock.instant().plus(timeout);
            this.timer = scheduler.schedule(
                    () -> token.cancel(new DeadlineExceededException("context deadline exceeded after " + timeout)),
                    timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    public static DetachedContext detach(ExecutionContext parent, Duration timeout) {
        return new DetachedContext(parent, timeout, SHARED_TIMER, Clock.systemUTC());
    }

    public static DetachedContext detach(ExecutionContext parent, Duration timeout,
                                         ScheduledExecutorService scheduler, Clock clock) {
        return new DetachedContext(parent, timeout, scheduler, clock);
    }

    /** Cancels this context before its deadline. */
    public boolean cancel() {
        return token.cancel();
    }

    @Override
    public RequestEnvironment environment() {
        return parent.environment();
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
        if (timer != null) {
            timer.cancel(false);
        }
        token.cancel();
    }
}
