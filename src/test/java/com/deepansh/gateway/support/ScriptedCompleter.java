package com.deepansh.gateway.support;

import com.deepansh.gateway.context.ExecutionContext;
import com.deepansh.gateway.llm.ProviderCompleter;
import com.deepansh.gateway.model.ChatChunk;
import com.deepansh.gateway.model.ChatRequest;
import com.deepansh.gateway.model.ChatResponse;
import com.deepansh.gateway.stream.ChatStream;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Backend fake that replays a fixed script, one entry per round, and records every
 * request it receives. Once the script runs out the last entry repeats.
 */
public class ScriptedCompleter implements ProviderCompleter {

    private final Deque<Supplier<ChatResponse>> completions = new ArrayDeque<>();
    private final Deque<StreamedRound> streams = new ArrayDeque<>();
    private final List<ChatRequest> requests = new CopyOnWriteArrayList<>();
    private final ExecutorService executor;

    private record StreamedRound(List<ChatChunk> chunks, RuntimeException error) {
    }

    public ScriptedCompleter(ExecutorService executor) {
        this.executor = executor;
    }

    public ScriptedCompleter thenAnswer(ChatResponse response) {
        completions.addLast(() -> response);
        return this;
    }

    public ScriptedCompleter thenFail(RuntimeException error) {
        completions.addLast(() -> {
            throw error;
        });
        return this;
    }

    public ScriptedCompleter thenStream(ChatChunk... chunks) {
        streams.addLast(new StreamedRound(List.of(chunks), null));
        return this;
    }

    public ScriptedCompleter thenStreamAndFail(RuntimeException error, ChatChunk... chunks) {
        streams.addLast(new StreamedRound(List.of(chunks), error));
        return this;
    }

    @Override
    public synchronized ChatResponse complete(ExecutionContext ctx, ChatRequest request) {
        requests.add(request);
        Supplier<ChatResponse> next = completions.size() > 1 ? completions.pollFirst() : completions.peekFirst();
        if (next == null) {
            throw new IllegalStateException("no scripted completion left");
        }
        return next.get();
    }

    @Override
    public synchronized ChatStream streamComplete(ExecutionContext ctx, ChatRequest request) {
        requests.add(request);
        StreamedRound round = streams.size() > 1 ? streams.pollFirst() : streams.peekFirst();
        if (round == null) {
            throw new IllegalStateException("no scripted stream left");
        }
        return ChatStream.start(ctx, executor, (producerCtx, sink) -> {
            for (ChatChunk chunk : round.chunks()) {
                if (!sink.emit(copy(chunk))) {
                    return;
                }
            }
            if (round.error() != null) {
                throw round.error();
            }
        });
    }

    public List<ChatRequest> requests() {
        return new ArrayList<>(requests);
    }

    public int calls() {
        return requests.size();
    }

    /** Chunks get mutated downstream (id patching); hand out a fresh copy per round. */
    private static ChatChunk copy(ChatChunk chunk) {
        List<ChatChunk.Choice> choices = new ArrayList<>();
        for (ChatChunk.Choice c : chunk.getChoices()) {
            ChatChunk.Delta d = c.getDelta();
            List<ChatChunk.ToolCallDelta> calls = null;
            if (d.getToolCalls() != null) {
                calls = new ArrayList<>();
                for (ChatChunk.ToolCallDelta t : d.getToolCalls()) {
                    calls.add(ChatChunk.ToolCallDelta.builder()
                            .index(t.getIndex()).id(t.getId()).type(t.getType())
                            .function(t.getFunction() == null ? null : ChatChunk.FunctionDelta.builder()
                                    .name(t.getFunction().getName())
                                    .arguments(t.getFunction().getArguments())
                                    .build())
                            .build());
                }
            }
            choices.add(ChatChunk.Choice.builder()
                    .index(c.getIndex())
                    .finishReason(c.getFinishReason())
                    .delta(ChatChunk.Delta.builder()
                            .role(d.getRole()).content(d.getContent()).refusal(d.getRefusal())
                            .toolCalls(calls)
                            .build())
                    .build());
        }
        return ChatChunk.builder()
                .id(chunk.getId()).model(chunk.getModel()).created(chunk.getCreated())
                .choices(choices).usage(chunk.getUsage())
                .build();
    }
}
