package com.deepansh.gateway.context;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Cooperative cancellation signal. Cancelling is one-shot: the first cause wins and
 * every registered callback runs exactly once, on the cancelling thread.
 */
public final class CancellationToken {

    private final Object lock = new Object();
    private final Set<Runnable> callbacks = new LinkedHashSet<>();
    private volatile CancelledException cause;

    public boolean cancel() {
        return cancel(new CancelledException("context cancelled"));
    }

    /**
     * @return true if this call performed the cancellation, false if it was already cancelled
     */
    public boolean cancel(CancelledException reason) {
        List<Runnable> toRun;
        synchronized (lock) {
            if (cause != null) {
                return false;
            }
            cause = reason;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        toRun.forEach(Runnable::run);
        return true;
    }

    public boolean isCancelled() {
        return cause != null;
    }

    /** The cancellation cause, or null while still live. */
    public CancelledException cause() {
        return cause;
    }

    public void throwIfCancelled() {
        CancelledException c = cause;
        if (c != null) {
            throw c;
        }
    }

    /**
     * Registers a callback fired on cancellation. Runs immediately on the calling
     * thread if the token is already cancelled.
     */
    public Registration onCancel(Runnable callback) {
        synchronized (lock) {
            if (cause == null) {
                callbacks.add(callback);
                return () -> {
                    synchronized (lock) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        callback.run();
        return () -> { };
    }

    /** A new token cancelled together with this one, but cancellable on its own too. */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        Registration link = onCancel(() -> child.cancel(cause));
        child.onCancel(link::close);
        return child;
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
