package com.deepansh.gateway.stream;

import com.deepansh.gateway.context.CancellableContext;
import com.deepansh.gateway.context.ExecutionContext;

import java.util.concurrent.Executor;

/**
 * Stream of Responses-protocol events.
 */
public class ResponseStream extends EventStream<ResponseStreamEvent> {

    private ResponseStream(BoundedChannel<ResponseStreamEvent> channel, CancellableContext producerContext) {
        super(channel, producerContext);
    }

    public static ResponseStream start(ExecutionContext ctx, Executor executor, int capacity,
                                       Producer<ResponseStreamEvent> producer) {
        BoundedChannel<ResponseStreamEvent> channel = new BoundedChannel<>(capacity);
        return new ResponseStream(channel, launch(ctx, executor, channel, producer));
    }
}
