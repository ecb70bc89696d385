package com.deepansh.gateway.accumulate;

import com.deepansh.gateway.model.ChatChunk;
import com.deepansh.gateway.model.ChatResponse;
import com.deepansh.gateway.model.ToolCall;
import com.deepansh.gateway.model.Usage;
import com.deepansh.gateway.support.Chunks;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CompletionAccumulatorTest {

    private final CompletionAccumulator accumulator = new CompletionAccumulator();

    @Test
    void content_isExposedOnlyAfterStop() {
        accumulator.addChunk(Chunks.text("Hel"));
        accumulator.addChunk(Chunks.text("lo"));

        assertThat(accumulator.finishedContent()).isEmpty();
        assertThat(accumulator.content()).isEqualTo("Hello");

        accumulator.addChunk(Chunks.finish(ChatChunk.FINISH_STOP));

        assertThat(accumulator.finishedContent()).contains("Hello");
        assertThat(accumulator.isComplete()).isTrue();
    }

    @Test
    void toolCalls_areExposedOnlyAfterToolCallsFinish() {
        accumulator.addChunk(Chunks.toolCallDelta(0, "call_1", "echo", "{\"message\":"));
        accumulator.addChunk(Chunks.toolCallDelta(0, null, null, "\"hi\"}"));

        assertThat(accumulator.finishedToolCalls()).isEmpty();

        accumulator.addChunk(Chunks.finish(ChatChunk.FINISH_TOOL_CALLS));

        List<ToolCall> calls = accumulator.finishedToolCalls().orElseThrow();
        assertThat(calls).hasSize(1);
        assertThat(calls.get(0).getArguments()).containsEntry("message", "hi");
        assertThat(accumulator.finishedContent()).isEmpty();
    }

    @Test
    void lengthFinish_exposesNeitherContentNorToolCalls() {
        accumulator.addChunk(Chunks.text("cut"));
        accumulator.addChunk(Chunks.finish(ChatChunk.FINISH_LENGTH));

        assertThat(accumulator.finishedContent()).isEmpty();
        assertThat(accumulator.finishedToolCalls()).isEmpty();
        assertThat(accumulator.finishReason()).isEqualTo("length");
    }

    @Test
    void refusalFragments_concatenate() {
        assertThat(accumulator.finishedRefusal()).isEmpty();

        accumulator.addChunk(refusal("I can't "));
        accumulator.addChunk(refusal("help with that"));
        accumulator.addChunk(Chunks.finish(ChatChunk.FINISH_STOP));

        assertThat(accumulator.finishedRefusal()).contains("I can't help with that");
        assertThat(accumulator.toResponse().firstMessage().getRefusal()).isEqualTo("I can't help with that");
    }

    @Test
    void usage_isTakenFromUsageChunk() {
        accumulator.addChunk(Chunks.text("ok"));
        accumulator.addChunk(Chunks.finish(ChatChunk.FINISH_STOP));
        accumulator.addChunk(Chunks.usage(10, 2));

        assertThat(accumulator.usage()).isEqualTo(new Usage(10, 2));
    }

    @Test
    void toResponse_buildsAssistantMessage() {
        accumulator.addChunk(Chunks.text("done"));
        accumulator.addChunk(Chunks.finish(ChatChunk.FINISH_STOP));

        ChatResponse response = accumulator.toResponse();

        assertThat(response.getId()).isEqualTo("chatcmpl-test");
        assertThat(response.firstMessage().contentAsText()).isEqualTo("done");
        assertThat(response.firstChoice().getFinishReason()).isEqualTo("stop");
    }

    @Test
    void reset_forgetsEverything() {
        accumulator.addChunk(Chunks.text("x"));
        accumulator.addChunk(Chunks.finish(ChatChunk.FINISH_STOP));

        accumulator.reset();

        assertThat(accumulator.isComplete()).isFalse();
        assertThat(accumulator.content()).isEmpty();
        assertThat(accumulator.usage()).isNull();
    }

    private static ChatChunk refusal(String fragment) {
        ChatChunk chunk = Chunks.text(null);
        chunk.getChoices().get(0).getDelta().setRefusal(fragment);
        return chunk;
    }
}
