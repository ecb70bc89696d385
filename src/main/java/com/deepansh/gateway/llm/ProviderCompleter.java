package com.deepansh.gateway.llm;

import com.deepansh.gateway.context.ExecutionContext;
import com.deepansh.gateway.model.ChatRequest;
import com.deepansh.gateway.model.ChatResponse;
import com.deepansh.gateway.stream.ChatStream;

/**
 * One model backend, spoken to in the canonical chat model. Implementations
 * translate to and from their native wire format.
 */
public interface ProviderCompleter {

    /**
     * Sends the conversation and waits for the complete answer.
     *
     * @throws ProviderException when the backend rejects or fails the request
     */
    ChatResponse complete(ExecutionContext ctx, ChatRequest request);

    /**
     * Starts a streamed completion. Errors after the request was accepted surface
     * through {@link ChatStream#error()}.
     */
    ChatStream streamComplete(ExecutionContext ctx, ChatRequest request);
}
