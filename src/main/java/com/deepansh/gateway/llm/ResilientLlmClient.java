package com.deepansh.gateway.llm;

import com.deepansh.gateway.context.ExecutionContext;
import com.deepansh.gateway.model.ChatRequest;
import com.deepansh.gateway.model.ChatResponse;
import com.deepansh.gateway.stream.ChatStream;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/**
 * Circuit breaker in front of the active backend client.
 *
 * Only the breaker is applied: provider errors pass through unchanged and are never
 * retried at this layer. While the circuit is open, calls fail fast with a 503
 * ProviderException instead of reaching the backend.
 *
 * Breaker config (application.yml, instance "llmClient"):
 * - opens at 50% failures over a window of 10 calls
 * - waits 30s before letting probe calls through
 * - only rate limits, server errors and transport failures count as failures
 */
@Component
@Primary
@Slf4j
public class ResilientLlmClient implements ProviderCompleter {

    private final ProviderCompleter delegate;

    public ResilientLlmClient(@Qualifier("activeLlmClient") ProviderCompleter delegate) {
        this.delegate = delegate;
    }

    @Override
    @CircuitBreaker(name = "llmClient", fallbackMethod = "completeRejected")
    public ChatResponse complete(ExecutionContext ctx, ChatRequest request) {
        return delegate.complete(ctx, request);
    }

    /**
     * Guards stream start-up only; failures after the first chunk travel on the
     * stream itself and are not seen by the breaker.
     */
    @Override
    @CircuitBreaker(name = "llmClient", fallbackMethod = "streamRejected")
    public ChatStream streamComplete(ExecutionContext ctx, ChatRequest request) {
        return delegate.streamComplete(ctx, request);
    }

    public ChatResponse completeRejected(ExecutionContext ctx, ChatRequest request, CallNotPermittedException ex) {
        throw circuitOpen(ex);
    }

    public ChatStream streamRejected(ExecutionContext ctx, ChatRequest request, CallNotPermittedException ex) {
        throw circuitOpen(ex);
    }

    private ProviderException circuitOpen(CallNotPermittedException ex) {
        log.error("LLM circuit breaker is OPEN, rejecting call: {}", ex.getMessage());
        return new ProviderException(503, "server_error",
                "The model backend is currently unavailable. Please try again in about 30 seconds.",
                "circuit_open", null);
    }
}
