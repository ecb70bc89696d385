package com.deepansh.gateway.stream;

import com.deepansh.gateway.context.CancellationToken;
import com.deepansh.gateway.context.CancelledException;

import java.util.ArrayDeque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-capacity hand-off between exactly one producer and one consumer.
 *
 * The producer ends the channel with {@link #close()} or {@link #fail(Throwable)}.
 * Either way the consumer first receives everything already buffered, then sees
 * the end (null) and can read the failure, if any.
 */
public final class BoundedChannel<T> {

    public static final int DEFAULT_CAPACITY = 50;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private final ArrayDeque<T> buffer;
    private final int capacity;

    private boolean closed;
    private Throwable failure;

    public BoundedChannel() {
        this(DEFAULT_CAPACITY);
    }

    public BoundedChannel(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(capacity);
    }

    /**
     * Blocks while the buffer is full.
     *
     * @return false when the item was not delivered because the channel is closed
     *         or the producer's token was cancelled
     */
    public boolean send(T item, CancellationToken producerToken) {
        try (CancellationToken.Registration ignored = producerToken.onCancel(this::wakeAll)) {
            lock.lock();
            try {
                while (buffer.size() >= capacity && !closed && !producerToken.isCancelled()) {
                    notFull.await();
                }
                if (closed || producerToken.isCancelled()) {
                    return false;
                }
                buffer.addLast(item);
                notEmpty.signal();
                return true;
            } finally {
                lock.unlock();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Takes the next item, blocking while the buffer is empty and the channel open.
     *
     * @return the next item, or null once the channel is closed and drained
     * @throws CancelledException when the consumer's token is cancelled
     */
    public T receive(CancellationToken consumerToken) {
        try (CancellationToken.Registration ignored = consumerToken.onCancel(this::wakeAll)) {
            lock.lock();
            try {
                while (true) {
                    consumerToken.throwIfCancelled();
                    T next = buffer.pollFirst();
                    if (next != null) {
                        notFull.signal();
                        return next;
                    }
                    if (closed) {
                        return null;
                    }
                    notEmpty.await();
                }
            } finally {
                lock.unlock();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException("interrupted while receiving");
        }
    }

    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Records the failure (first one wins) and closes the channel. */
    public void fail(Throwable error) {
        lock.lock();
        try {
            if (failure == null) {
                failure = error;
            }
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public Throwable failure() {
        lock.lock();
        try {
            return failure;
        } finally {
            lock.unlock();
        }
    }

    private void wakeAll() {
        lock.lock();
        try {
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
