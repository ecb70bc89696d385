package com.deepansh.gateway.response;

import com.deepansh.gateway.model.ResponseObject;
import com.deepansh.gateway.model.ResponseStatus;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * State of one asynchronous response, shared between the background task that
 * produces it, any number of readers and a canceller.
 *
 * Starts {@code in_progress}; exactly one of {@link #setResult}, {@link #setError}
 * or {@link #cancel} moves it to a terminal status, whichever takes the write lock
 * first. Later transitions are ignored.
 */
public class ResponseState {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final CompletableFuture<ResponseStatus> terminal = new CompletableFuture<>();

    private final String id;
    private final Instant createdAt;
    private final Runnable cancelHandle;

    private ResponseStatus status = ResponseStatus.in_progress;
    private ResponseObject result;
    private Throwable error;

    public ResponseState(String id, Instant createdAt, Runnable cancelHandle) {
        this.id = id;
        this.createdAt = createdAt;
        this.cancelHandle = cancelHandle;
    }

    public String getId() {
        return id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /** Marks the response completed. Returns false if it had already ended. */
    public boolean setResult(ResponseObject result) {
        return finish(ResponseStatus.completed, result, null);
    }

    /** Marks the response failed. Returns false if it had already ended. */
    public boolean setError(Throwable error) {
        return finish(ResponseStatus.failed, null, error);
    }

    /**
     * Fires the cancellation handle and marks the response cancelled unless it already
     * ended. The handle is advisory: the task may still be running when this returns.
     */
    public boolean cancel() {
        lock.writeLock().lock();
        try {
            if (cancelHandle != null) {
                cancelHandle.run();
            }
            return transition(ResponseStatus.cancelled, null, null);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public ResponseStatus getStatus() {
        lock.readLock().lock();
        try {
            return status;
        } finally {
            lock.readLock().unlock();
        }
    }

    public ResponseObject getResult() {
        lock.readLock().lock();
        try {
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Throwable getError() {
        lock.readLock().lock();
        try {
            return error;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isTerminal() {
        return getStatus().isTerminal();
    }

    /** Terminal and created before {@code cutoff}. */
    public boolean isExpired(Instant cutoff) {
        lock.readLock().lock();
        try {
            return status.isTerminal() && createdAt.isBefore(cutoff);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * A view that completes with the terminal status once the response ends. Completing
     * or cancelling the view does not affect this entry.
     */
    public CompletableFuture<ResponseStatus> whenTerminal() {
        return terminal.copy();
    }

    private boolean finish(ResponseStatus next, ResponseObject value, Throwable failure) {
        lock.writeLock().lock();
        try {
            return transition(next, value, failure);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private boolean transition(ResponseStatus next, ResponseObject value, Throwable failure) {
        if (status.isTerminal()) {
            return false;
        }
        status = next;
        result = value;
        error = failure;
        terminal.complete(next);
        return true;
    }
}
