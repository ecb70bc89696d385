package com.deepansh.gateway.stream;

import com.deepansh.gateway.context.CancellableContext;
import com.deepansh.gateway.context.ExecutionContext;
import com.deepansh.gateway.model.ChatChunk;

import java.util.concurrent.Executor;

/**
 * Stream of chat completion chunks.
 */
public class ChatStream extends EventStream<ChatChunk> {

    private ChatStream(BoundedChannel<ChatChunk> channel, CancellableContext producerContext) {
        super(channel, producerContext);
    }

    public static ChatStream start(ExecutionContext ctx, Executor executor, int capacity,
                                   Producer<ChatChunk> producer) {
        BoundedChannel<ChatChunk> channel = new BoundedChannel<>(capacity);
        return new ChatStream(channel, launch(ctx, executor, channel, producer));
    }

    public static ChatStream start(ExecutionContext ctx, Executor executor, Producer<ChatChunk> producer) {
        return start(ctx, executor, BoundedChannel.DEFAULT_CAPACITY, producer);
    }
}
