package com.deepansh.gateway.stream;

import com.deepansh.gateway.context.CancellableContext;
import com.deepansh.gateway.context.CancelledException;
import com.deepansh.gateway.context.ExecutionContext;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Pull-style consumer over a {@link BoundedChannel} fed by one background producer.
 *
 * <pre>
 * while (stream.next()) {
 *     handle(stream.current());
 * }
 * if (stream.error() != null) { ... }
 * </pre>
 */
@Slf4j
public abstract class EventStream<T> implements AutoCloseable {

    /** Pushes one item downstream; false means the consumer is gone and the producer should stop. */
    @FunctionalInterface
    public interface Sink<T> {
        boolean emit(T item);
    }

    @FunctionalInterface
    public interface Producer<T> {
        void produce(ExecutionContext ctx, Sink<T> sink) throws Exception;
    }

    private final BoundedChannel<T> channel;
    private final CancellableContext producerContext;
    private T current;
    private Throwable error;

    protected EventStream(BoundedChannel<T> channel, CancellableContext producerContext) {
        this.channel = channel;
        this.producerContext = producerContext;
    }

    /**
     * Starts {@code producer} on {@code executor}. The producer runs under a child of
     * {@code ctx}, so cancelling the caller or closing the stream both stop it.
     */
    protected static <T> CancellableContext launch(ExecutionContext ctx, Executor executor,
                                                   BoundedChannel<T> channel, Producer<T> producer) {
        CancellableContext producerCtx = CancellableContext.withCancel(ctx);
        Runnable body = () -> {
            try {
                producer.produce(producerCtx, item -> channel.send(item, producerCtx.cancellation()));
                channel.close();
            } catch (Throwable t) {
                log.debug("Stream producer ended with error: {}", t.toString());
                channel.fail(t);
            }
        };
        try {
            executor.execute(body);
        } catch (RejectedExecutionException e) {
            channel.fail(new StreamException("stream producer rejected: " + e.getMessage(), e));
        }
        return producerCtx;
    }

    /**
     * Advances to the next item. Returns false at the end of the stream, after which
     * {@link #error()} tells a clean end apart from a failure.
     */
    public boolean next() {
        if (error != null) {
            return false;
        }
        try {
            T item = channel.receive(producerContext.cancellation());
            if (item == null) {
                error = channel.failure();
                current = null;
                return false;
            }
            current = item;
            return true;
        } catch (CancelledException e) {
            error = channel.failure() != null ? channel.failure() : e;
            current = null;
            return false;
        }
    }

    public T current() {
        return current;
    }

    /** The failure that ended the stream, or null if it ended cleanly (or is still running). */
    public Throwable error() {
        return error;
    }

    /** Stops the producer and discards anything still buffered. */
    @Override
    public void close() {
        channel.close();
        producerContext.cancel();
    }
}
