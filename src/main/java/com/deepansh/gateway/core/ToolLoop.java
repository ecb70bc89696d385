package com.deepansh.gateway.core;

import com.deepansh.gateway.accumulate.CompletionAccumulator;
import com.deepansh.gateway.accumulate.StreamingToolCallAccumulator;
import com.deepansh.gateway.accumulate.TokenCounter;
import com.deepansh.gateway.config.GatewayProperties;
import com.deepansh.gateway.context.DetachedContext;
import com.deepansh.gateway.context.ExecutionContext;
import com.deepansh.gateway.llm.ProviderCompleter;
import com.deepansh.gateway.model.ChatChunk;
import com.deepansh.gateway.model.ChatRequest;
import com.deepansh.gateway.model.ChatResponse;
import com.deepansh.gateway.model.Message;
import com.deepansh.gateway.model.ToolCall;
import com.deepansh.gateway.model.ToolDescriptor;
import com.deepansh.gateway.model.Usage;
import com.deepansh.gateway.stream.ChatStream;
import com.deepansh.gateway.stream.EventStream;
import com.deepansh.gateway.stream.StreamException;
import com.deepansh.gateway.tool.ToolExecutor;
import com.deepansh.gateway.tool.ToolResult;
import com.deepansh.gateway.tool.ToolRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

/**
 * Turns one chat request into a bounded, multi-round tool-using conversation.
 *
 * Per-turn flow:
 * 1. If the caller sent its own tools, run exactly one round and hand the result back:
 *    the caller executes those tools itself.
 * 2. Otherwise offer the tools of every attached provider and loop:
 *    model -> tool calls -> tool results -> model, until the model stops calling tools.
 * 3. Usage is summed over all rounds.
 * 4. Running out of rounds is fatal ({@link LoopExhaustedException}).
 *
 * Each turn runs under a detached context with the configured request timeout, so a
 * caller going away does not abort a round half way.
 */
@Service
@Slf4j
public class ToolLoop {

    private final ProviderCompleter completer;
    private final ToolRouter router;
    private final ToolExecutor toolExecutor;
    private final ExecutorService ioExecutor;
    private final int maxRounds;
    private final Duration requestTimeout;
    private final int bufferCapacity;

    @Autowired
    public ToolLoop(ProviderCompleter completer,
                    ToolRouter router,
                    ToolExecutor toolExecutor,
                    @Qualifier("gatewayIoExecutor") ExecutorService ioExecutor,
                    GatewayProperties properties) {
        this(completer, router, toolExecutor, ioExecutor,
                properties.getLoop().getMaxRounds(),
                properties.getProvider().getRequestTimeout(),
                properties.getStream().getBufferCapacity());
    }

    public ToolLoop(ProviderCompleter completer, ToolRouter router, ToolExecutor toolExecutor,
                    ExecutorService ioExecutor, int maxRounds, Duration requestTimeout, int bufferCapacity) {
        this.completer = completer;
        this.router = router;
        this.toolExecutor = toolExecutor;
        this.ioExecutor = ioExecutor;
        this.maxRounds = maxRounds;
        this.requestTimeout = requestTimeout;
        this.bufferCapacity = bufferCapacity;
    }

    public ChatResponse complete(ExecutionContext ctx, ChatRequest request) {
        return withTurnContext(ctx, turn -> runRounds(turn, request));
    }

    /**
     * Streaming variant. Chunks are relayed as they arrive; while the loop owns tool
     * execution, chunks carrying tool-call deltas or a {@code tool_calls} finish are
     * withheld. The last chunk carries the usage summed over all rounds.
     */
    public ChatStream stream(ExecutionContext ctx, ChatRequest request) {
        return ChatStream.start(ctx, ioExecutor, bufferCapacity, (producerCtx, sink) ->
                withTurnContext(producerCtx, turn -> {
                    streamRounds(turn, request, sink);
                    return null;
                }));
    }

    private ChatResponse runRounds(ExecutionContext ctx, ChatRequest request) {
        boolean handlesTools = handlesTools(ctx, request);
        ConversationState state = new ConversationState(prepare(ctx, request, handlesTools));
        Usage cumulative = Usage.ZERO;

        for (int round = 1; round <= maxRounds; round++) {
            ctx.throwIfCancelled();
            log.info("Loop round {}/{} [handlesTools={}]", round, maxRounds, handlesTools);

            ChatResponse response = completer.complete(ctx, state.nextRequest());
            cumulative = cumulative.plus(response.getUsage());

            List<ToolCall> calls = response.toolCalls();
            if (!handlesTools || calls.isEmpty()) {
                response.setUsage(cumulative);
                log.info("Loop finished after {} round(s) [usage={}]", round, cumulative.totalTokens());
                return response;
            }

            Message assistant = response.firstMessage();
            runTools(ctx, state, assistant != null ? assistant.contentAsText() : null, calls);
        }

        log.warn("Loop hit max rounds ({})", maxRounds);
        throw new LoopExhaustedException(maxRounds);
    }

    private void streamRounds(ExecutionContext ctx, ChatRequest request, EventStream.Sink<ChatChunk> sink) {
        boolean handlesTools = handlesTools(ctx, request);
        ConversationState state = new ConversationState(prepare(ctx, request, handlesTools));
        Usage cumulative = Usage.ZERO;

        for (int round = 1; round <= maxRounds; round++) {
            ctx.throwIfCancelled();
            log.info("Streaming loop round {}/{} [handlesTools={}]", round, maxRounds, handlesTools);

            StreamedRound result = streamRound(ctx, state.nextRequest(), handlesTools, sink);
            if (result == null) {
                log.debug("Stream consumer went away, stopping loop");
                return;
            }
            cumulative = cumulative.plus(result.usage());

            if (!handlesTools || result.toolCalls().isEmpty()) {
                if (!cumulative.isEmpty()) {
                    sink.emit(ChatChunk.usageOnly(result.id(), result.model(), result.created(), cumulative));
                }
                log.info("Streaming loop finished after {} round(s) [usage={}]", round, cumulative.totalTokens());
                return;
            }

            runTools(ctx, state, result.content(), result.toolCalls());
        }

        log.warn("Streaming loop hit max rounds ({})", maxRounds);
        throw new LoopExhaustedException(maxRounds);
    }

    /**
     * Streams one round, relaying chunks to {@code sink}.
     *
     * @return the round's outcome, or null if the consumer stopped listening
     */
    private StreamedRound streamRound(ExecutionContext ctx, ChatRequest request, boolean handlesTools,
                                      EventStream.Sink<ChatChunk> sink) {
        StreamingToolCallAccumulator toolCalls = new StreamingToolCallAccumulator();
        CompletionAccumulator completion = new CompletionAccumulator();
        TokenCounter estimate = new TokenCounter();
        estimate.addPromptMessages(request.getMessages());

        try (ChatStream upstream = completer.streamComplete(ctx, request)) {
            while (upstream.next()) {
                ChatChunk chunk = upstream.current();
                assignMissingIds(chunk, toolCalls);
                completion.addChunk(chunk);
                if (chunk.getChoices() != null) {
                    chunk.getChoices().forEach(c -> estimate.addCompletionDelta(c.getDelta()));
                }

                boolean usageOnly = (chunk.getChoices() == null || chunk.getChoices().isEmpty())
                        && chunk.getUsage() != null;
                if (usageOnly) {
                    // republished as cumulative usage once the turn ends
                    continue;
                }
                if (handlesTools && chunk.carriesToolCalls()) {
                    continue;
                }
                if (!sink.emit(chunk)) {
                    return null;
                }
            }
            if (upstream.error() != null) {
                throw asRuntime(upstream.error());
            }
        }

        ChatResponse assembled = completion.toResponse();
        return new StreamedRound(
                completion.content(),
                toolCalls.finalizeCalls(),
                estimate.injectIfMissing(completion.usage()),
                assembled.getId(),
                assembled.getModel(),
                assembled.getCreated());
    }

    /** Writes synthesized ids into the chunk before anyone downstream sees it. */
    private void assignMissingIds(ChatChunk chunk, StreamingToolCallAccumulator toolCalls) {
        if (chunk.getChoices() == null || chunk.getChoices().isEmpty()) {
            return;
        }
        ChatChunk.Delta delta = chunk.getChoices().get(0).getDelta();
        if (delta == null || !delta.hasToolCalls()) {
            return;
        }
        toolCalls.processDelta(delta.getToolCalls(), (index, id) -> {
            for (ChatChunk.ToolCallDelta call : delta.getToolCalls()) {
                if (call.getIndex() == index) {
                    call.setId(id);
                    break;
                }
            }
        });
    }

    private void runTools(ExecutionContext ctx, ConversationState state, String assistantText, List<ToolCall> calls) {
        log.info("Model requested {} tool call(s): {}", calls.size(),
                calls.stream().map(ToolCall::getName).toList());
        List<ToolResult> results = toolExecutor.executeAll(ctx, calls);
        state.appendToolRound(assistantText, calls, results);
    }

    private boolean handlesTools(ExecutionContext ctx, ChatRequest request) {
        return !request.hasTools() && ctx.environment().hasToolProviders();
    }

    private ChatRequest prepare(ExecutionContext ctx, ChatRequest request, boolean handlesTools) {
        ChatRequest prepared = request.copy();
        prepared.setStream(null);
        prepared.setStreamOptions(null);
        if (handlesTools) {
            List<ToolDescriptor> tools = router.collectTools(ctx);
            prepared.setTools(tools.isEmpty() ? null : tools);
            log.debug("Offering {} tool(s) to the model", tools.size());
        }
        return prepared;
    }

    private <T> T withTurnContext(ExecutionContext ctx, Function<ExecutionContext, T> body) {
        if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
            return body.apply(ctx);
        }
        if (ctx instanceof DetachedContext) {
            // already detached: cancelling that context must still reach this turn
            return body.apply(ctx);
        }
        try (DetachedContext turn = DetachedContext.detach(ctx, requestTimeout)) {
            return body.apply(turn);
        }
    }

    private static RuntimeException asRuntime(Throwable error) {
        if (error instanceof RuntimeException re) {
            return re;
        }
        return new StreamException("streaming error: " + error.getMessage(), error);
    }

    private record StreamedRound(String content, List<ToolCall> toolCalls, Usage usage,
                                 String id, String model, long created) {
    }
}
