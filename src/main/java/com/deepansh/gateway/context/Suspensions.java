package com.deepansh.gateway.context;

import com.deepansh.gateway.exception.GatewayException;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs blocking work so that the caller can still observe cancellation while it waits.
 * The task goes to an executor; the caller returns as soon as the task finishes or the
 * context is cancelled, whichever comes first. A losing task is interrupted.
 */
public final class Suspensions {

    private Suspensions() {
    }

    public static <T> T await(ExecutionContext ctx, ExecutorService executor, Callable<T> task) {
        ctx.throwIfCancelled();

        CompletableFuture<T> outcome = new CompletableFuture<>();
        Future<?> running = executor.submit(() -> {
            try {
                outcome.complete(task.call());
            } catch (Throwable t) {
                outcome.completeExceptionally(t);
            }
        });

        try (CancellationToken.Registration ignored =
                     ctx.cancellation().onCancel(() -> outcome.completeExceptionally(ctx.cancellation().cause()))) {
            return outcome.get();
        } catch (ExecutionException e) {
            throw rethrow(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException("interrupted while waiting");
        } finally {
            if (!running.isDone()) {
                running.cancel(true);
            }
        }
    }

    /**
     * Waits for a future up to a bounded time, aborting early when the context is cancelled.
     *
     * @throws TimeoutException when the future is still pending after {@code timeout}
     */
    public static <T> T awaitFuture(ExecutionContext ctx, CompletableFuture<T> future, Duration timeout)
            throws TimeoutException {
        ctx.throwIfCancelled();

        CompletableFuture<T> outcome = new CompletableFuture<>();
        future.whenComplete((value, error) -> {
            if (error != null) {
                outcome.completeExceptionally(error);
            } else {
                outcome.complete(value);
            }
        });

        try (CancellationToken.Registration ignored =
                     ctx.cancellation().onCancel(() -> outcome.completeExceptionally(ctx.cancellation().cause()))) {
            return outcome.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw rethrow(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException("interrupted while waiting");
        }
    }

    private static RuntimeException rethrow(Throwable cause) {
        if (cause instanceof CompletionException ce && ce.getCause() != null) {
            cause = ce.getCause();
        }
        if (cause instanceof RuntimeException re) {
            return re;
        }
        if (cause instanceof Error err) {
            throw err;
        }
        return new GatewayException(cause.getMessage(), cause);
    }
}
