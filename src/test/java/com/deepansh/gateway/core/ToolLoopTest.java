package com.deepansh.gateway.core;

import com.deepansh.gateway.context.CancellableContext;
import com.deepansh.gateway.context.RequestEnvironment;
import com.deepansh.gateway.llm.ProviderException;
import com.deepansh.gateway.model.ChatChunk;
import com.deepansh.gateway.model.ChatRequest;
import com.deepansh.gateway.model.ChatResponse;
import com.deepansh.gateway.model.Message;
import com.deepansh.gateway.model.ToolDescriptor;
import com.deepansh.gateway.model.Usage;
import com.deepansh.gateway.stream.ChatStream;
import com.deepansh.gateway.stream.StreamException;
import com.deepansh.gateway.support.Chunks;
import com.deepansh.gateway.support.ScriptedCompleter;
import com.deepansh.gateway.tool.LocalToolProvider;
import com.deepansh.gateway.tool.ObserverException;
import com.deepansh.gateway.tool.ToolExecutor;
import com.deepansh.gateway.tool.ToolObserver;
import com.deepansh.gateway.tool.ToolProvider;
import com.deepansh.gateway.tool.ToolRouter;
import com.deepansh.gateway.tool.impl.EchoTool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ToolLoopTest {

    private static final int MAX_ROUNDS = 20;

    @Mock ToolProvider provider;
    @Mock ToolObserver observer;

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final ScriptedCompleter completer = new ScriptedCompleter(executor);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void complete_oneToolRoundThenStop_sumsUsage() throws Exception {
        givenProviderTool("lookup", "42");
        completer.thenAnswer(Chunks.toolCalls(new Usage(10, 5), Chunks.call("call_1", "lookup", Map.of("q", "x"))))
                .thenAnswer(Chunks.answer("The answer is 42", new Usage(20, 3)));

        ChatResponse response = loop(Duration.ZERO).complete(withProvider(), request());

        assertThat(response.firstMessage().contentAsText()).isEqualTo("The answer is 42");
        assertThat(response.getUsage()).isEqualTo(new Usage(30, 8));
        verify(provider, times(1)).callTool(any(), eq("lookup"), anyMap());
        assertThat(completer.calls()).isEqualTo(2);

        ChatRequest first = completer.requests().get(0);
        assertThat(first.getTools()).extracting(ToolDescriptor::getName).containsExactly("lookup");

        List<Message> second = completer.requests().get(1).getMessages();
        assertThat(second).hasSize(3);
        assertThat(second.get(1).getRole()).isEqualTo(Message.Role.assistant);
        assertThat(second.get(1).getToolCalls()).extracting(c -> c.getId()).containsExactly("call_1");
        assertThat(second.get(2).getRole()).isEqualTo(Message.Role.tool);
        assertThat(second.get(2).getToolCallId()).isEqualTo("call_1");
        assertThat(second.get(2).contentAsText()).isEqualTo("42");
    }

    @Test
    void complete_modelThatNeverStops_exhaustsAfterExactlyMaxRounds() throws Exception {
        givenProviderTool("lookup", "again");
        completer.thenAnswer(Chunks.toolCalls(new Usage(1, 1), Chunks.call("call_x", "lookup", Map.of())));

        assertThatThrownBy(() -> loop(Duration.ZERO).complete(withProvider(), request()))
                .isInstanceOf(LoopExhaustedException.class)
                .hasMessage("maximum tool call iterations (20) reached");

        assertThat(completer.calls()).isEqualTo(MAX_ROUNDS);
        verify(provider, times(MAX_ROUNDS)).callTool(any(), any(), anyMap());
    }

    @Test
    void complete_callerSuppliedTools_runsExactlyOneRound() throws Exception {
        completer.thenAnswer(Chunks.toolCalls(new Usage(4, 2), Chunks.call("call_1", "client_side", Map.of())));
        ChatRequest request = request().toBuilder()
                .tools(List.of(ToolDescriptor.builder().name("client_side").build()))
                .build();

        ChatResponse response = loop(Duration.ZERO).complete(withProvider(), request);

        assertThat(response.toolCalls()).hasSize(1);
        assertThat(completer.calls()).isEqualTo(1);
        verify(provider, never()).callTool(any(), any(), anyMap());
    }

    @Test
    void complete_noProvidersAttached_returnsToolCallsUnexecuted() {
        completer.thenAnswer(Chunks.toolCalls(new Usage(4, 2), Chunks.call("call_1", "lookup", Map.of())));

        ChatResponse response = loop(Duration.ZERO).complete(CancellableContext.background(), request());

        assertThat(response.toolCalls()).hasSize(1);
        assertThat(completer.calls()).isEqualTo(1);
        assertThat(completer.requests().get(0).getTools()).isNull();
    }

    @Test
    void complete_unknownTool_isReportedToTheModel() {
        completer.thenAnswer(Chunks.toolCalls(new Usage(1, 1), Chunks.call("call_1", "missing", Map.of())))
                .thenAnswer(Chunks.answer("sorry", new Usage(1, 1)));
        CancellableContext ctx = CancellableContext.of(RequestEnvironment.builder()
                .localProvider(new LocalToolProvider(List.of(new EchoTool())))
                .build());

        loop(Duration.ZERO).complete(ctx, request());

        Message toolMessage = completer.requests().get(1).getMessages().get(2);
        assertThat(toolMessage.contentAsText()).isEqualTo("Error: no tool provider available for tool: missing");
    }

    @Test
    void complete_observerFailure_abortsTheTurn() throws Exception {
        when(provider.listTools(any())).thenReturn(List.of(ToolDescriptor.builder().name("lookup").build()));
        doThrow(new IllegalStateException("client gone")).when(observer).onCall(any());
        completer.thenAnswer(Chunks.toolCalls(new Usage(1, 1), Chunks.call("call_1", "lookup", Map.of())))
                .thenAnswer(Chunks.answer("never", new Usage(1, 1)));
        CancellableContext ctx = CancellableContext.of(RequestEnvironment.builder()
                .localProvider(provider)
                .observer(observer)
                .build());

        assertThatThrownBy(() -> loop(Duration.ZERO).complete(ctx, request()))
                .isInstanceOf(ObserverException.class);
        assertThat(completer.calls()).isEqualTo(1);
        verify(provider, never()).callTool(any(), any(), anyMap());
    }

    @Test
    void complete_providerError_isSurfacedVerbatim() {
        ProviderException rateLimited = ProviderException.rateLimit("slow down");
        completer.thenFail(rateLimited);

        assertThatThrownBy(() -> loop(Duration.ZERO).complete(CancellableContext.background(), request()))
                .isSameAs(rateLimited);
    }

    @Test
    void complete_detachedTurn_ignoresCallerCancellation() {
        completer.thenAnswer(Chunks.answer("still here", new Usage(1, 1)));
        CancellableContext caller = CancellableContext.background();
        caller.cancel();

        ChatResponse response = loop(Duration.ofMinutes(1)).complete(caller, request());

        assertThat(response.firstMessage().contentAsText()).isEqualTo("still here");
    }

    @Test
    void stream_callerTools_relaysChunksWithSynthesizedIds() {
        completer.thenStream(
                Chunks.toolCallDelta(0, null, "client_side", "{\"q\":"),
                Chunks.toolCallDelta(0, null, null, "1}"),
                Chunks.finish(ChatChunk.FINISH_TOOL_CALLS),
                Chunks.usage(5, 2));
        ChatRequest request = request().toBuilder()
                .tools(List.of(ToolDescriptor.builder().name("client_side").build()))
                .build();

        List<ChatChunk> relayed = drain(loop(Duration.ZERO).stream(CancellableContext.background(), request));

        String id = relayed.get(0).getChoices().get(0).getDelta().getToolCalls().get(0).getId();
        assertThat(id).startsWith("call_");
        assertThat(relayed).hasSize(4);
        assertThat(relayed.get(2).getChoices().get(0).getFinishReason()).isEqualTo("tool_calls");
        assertThat(relayed.get(3).getUsage()).isEqualTo(new Usage(5, 2));
        assertThat(completer.calls()).isEqualTo(1);
    }

    @Test
    void stream_loopOwnedTools_areWithheld_andUsageIsCumulative() throws Exception {
        givenProviderTool("lookup", "42");
        completer.thenStream(
                        Chunks.toolCallDelta(0, "call_1", "lookup", "{}"),
                        Chunks.finish(ChatChunk.FINISH_TOOL_CALLS),
                        Chunks.usage(10, 5))
                .thenStream(
                        Chunks.text("It is "),
                        Chunks.text("42"),
                        Chunks.finish(ChatChunk.FINISH_STOP),
                        Chunks.usage(20, 3));

        List<ChatChunk> relayed = drain(loop(Duration.ofMinutes(1)).stream(withProvider(), request()));

        assertThat(relayed).noneMatch(ChatChunk::carriesToolCalls);
        StringBuilder text = new StringBuilder();
        relayed.forEach(c -> c.getChoices().forEach(choice -> {
            if (choice.getDelta().getContent() != null) {
                text.append(choice.getDelta().getContent());
            }
        }));
        assertThat(text.toString()).isEqualTo("It is 42");
        assertThat(relayed.get(relayed.size() - 1).getUsage()).isEqualTo(new Usage(30, 8));
        verify(provider, times(1)).callTool(any(), eq("lookup"), anyMap());
    }

    @Test
    void stream_modelThatNeverStops_exhaustsAfterExactlyMaxRounds() throws Exception {
        givenProviderTool("lookup", "again");
        completer.thenStream(
                Chunks.toolCallDelta(0, "call_x", "lookup", "{}"),
                Chunks.finish(ChatChunk.FINISH_TOOL_CALLS),
                Chunks.usage(1, 1));

        try (ChatStream stream = loop(Duration.ZERO).stream(withProvider(), request())) {
            while (stream.next()) {
                assertThat(stream.current().carriesToolCalls()).isFalse();
            }
            assertThat(stream.error())
                    .isInstanceOf(LoopExhaustedException.class)
                    .hasMessage("maximum tool call iterations (20) reached");
        }

        assertThat(completer.calls()).isEqualTo(MAX_ROUNDS);
        verify(provider, times(MAX_ROUNDS)).callTool(any(), any(), anyMap());
    }

    @Test
    void stream_withoutReportedUsage_publishesEstimate() {
        completer.thenStream(Chunks.text("hello there"), Chunks.finish(ChatChunk.FINISH_STOP));

        List<ChatChunk> relayed = drain(loop(Duration.ZERO).stream(CancellableContext.background(), request()));

        Usage usage = relayed.get(relayed.size() - 1).getUsage();
        assertThat(usage).isNotNull();
        assertThat(usage.completionTokens()).isEqualTo(2);
        assertThat(usage.promptTokens()).isPositive();
    }

    @Test
    void stream_upstreamError_reachesConsumerAfterBufferedChunks() {
        completer.thenStreamAndFail(new StreamException("connection reset"), Chunks.text("partial"));

        try (ChatStream stream = loop(Duration.ZERO).stream(CancellableContext.background(), request())) {
            assertThat(stream.next()).isTrue();
            assertThat(stream.current().getChoices().get(0).getDelta().getContent()).isEqualTo("partial");
            assertThat(stream.next()).isFalse();
            assertThat(stream.error()).isInstanceOf(StreamException.class).hasMessage("connection reset");
        }
    }

    private ToolLoop loop(Duration requestTimeout) {
        ToolRouter router = new ToolRouter();
        return new ToolLoop(completer, router, new ToolExecutor(router, executor, false),
                executor, MAX_ROUNDS, requestTimeout, 50);
    }

    private void givenProviderTool(String name, String result) throws Exception {
        when(provider.listTools(any())).thenReturn(List.of(ToolDescriptor.builder().name(name).build()));
        when(provider.callTool(any(), eq(name), anyMap())).thenReturn(result);
    }

    private CancellableContext withProvider() {
        return CancellableContext.of(RequestEnvironment.builder().localProvider(provider).build());
    }

    private static ChatRequest request() {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.user("What is the answer?"));
        return ChatRequest.builder().model("test-model").messages(messages).build();
    }

    private static List<ChatChunk> drain(ChatStream stream) {
        List<ChatChunk> chunks = new ArrayList<>();
        try (stream) {
            while (stream.next()) {
                chunks.add(stream.current());
            }
            assertThat(stream.error()).isNull();
        }
        return chunks;
    }
}
