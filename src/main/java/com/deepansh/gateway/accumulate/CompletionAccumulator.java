package com.deepansh.gateway.accumulate;

import com.deepansh.gateway.model.ChatChunk;
import com.deepansh.gateway.model.ChatResponse;
import com.deepansh.gateway.model.Message;
import com.deepansh.gateway.model.ToolCall;
import com.deepansh.gateway.model.Usage;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Folds streamed chunks back into the single response they represent.
 *
 * Content and refusal text concatenate per choice. Finalized content is only handed
 * out once the choice finished with {@code stop}, finalized tool calls only once it
 * finished with {@code tool_calls}; before that the accessors return empty.
 */
public class CompletionAccumulator {

    private final List<ChoiceState> choices = new ArrayList<>();
    private String id;
    private String model;
    private long created;
    private Usage usage;

    private static final class ChoiceState {
        final StringBuilder content = new StringBuilder();
        final StringBuilder refusal = new StringBuilder();
        final StreamingToolCallAccumulator toolCalls = new StreamingToolCallAccumulator();
        String finishReason;
    }

    public void addChunk(ChatChunk chunk) {
        if (chunk == null) {
            return;
        }
        if (chunk.getId() != null) {
            id = chunk.getId();
        }
        if (chunk.getModel() != null) {
            model = chunk.getModel();
        }
        if (chunk.getCreated() != 0) {
            created = chunk.getCreated();
        }
        if (chunk.getUsage() != null) {
            usage = chunk.getUsage();
        }
        if (chunk.getChoices() == null) {
            return;
        }
        for (ChatChunk.Choice choice : chunk.getChoices()) {
            ChoiceState state = choice(choice.getIndex());
            ChatChunk.Delta delta = choice.getDelta();
            if (delta != null) {
                if (delta.getContent() != null) {
                    state.content.append(delta.getContent());
                }
                if (delta.getRefusal() != null) {
                    state.refusal.append(delta.getRefusal());
                }
                state.toolCalls.processDelta(delta.getToolCalls());
            }
            if (choice.getFinishReason() != null && !choice.getFinishReason().isEmpty()) {
                state.finishReason = choice.getFinishReason();
            }
        }
    }

    public Optional<String> finishedContent() {
        return finishedContent(0);
    }

    public Optional<String> finishedContent(int index) {
        ChoiceState state = existing(index);
        if (state == null || !ChatChunk.FINISH_STOP.equals(state.finishReason)) {
            return Optional.empty();
        }
        return Optional.of(state.content.toString());
    }

    public Optional<List<ToolCall>> finishedToolCalls() {
        return finishedToolCalls(0);
    }

    public Optional<List<ToolCall>> finishedToolCalls(int index) {
        ChoiceState state = existing(index);
        if (state == null || !ChatChunk.FINISH_TOOL_CALLS.equals(state.finishReason)) {
            return Optional.empty();
        }
        List<ToolCall> calls = state.toolCalls.finalizeCalls();
        return calls.isEmpty() ? Optional.empty() : Optional.of(calls);
    }

    public Optional<String> finishedRefusal() {
        ChoiceState state = existing(0);
        if (state == null || state.refusal.length() == 0) {
            return Optional.empty();
        }
        return Optional.of(state.refusal.toString());
    }

    /** Content accumulated so far for the first choice, finished or not. */
    public String content() {
        ChoiceState state = existing(0);
        return state != null ? state.content.toString() : "";
    }

    public String finishReason() {
        ChoiceState state = existing(0);
        return state != null ? state.finishReason : null;
    }

    public boolean isComplete() {
        return finishReason() != null;
    }

    /** Last usage seen on the stream, or null if the backend sent none. */
    public Usage usage() {
        return usage;
    }

    public void reset() {
        choices.clear();
        id = null;
        model = null;
        created = 0;
        usage = null;
    }

    /** The accumulated state as a non-streamed response. */
    public ChatResponse toResponse() {
        List<ChatResponse.Choice> out = new ArrayList<>();
        for (int i = 0; i < choices.size(); i++) {
            ChoiceState state = choices.get(i);
            List<ToolCall> calls = state.toolCalls.finalizeCalls();
            Message message = Message.builder()
                    .role(Message.Role.assistant)
                    .text(state.content.length() > 0 || calls.isEmpty() ? state.content.toString() : null)
                    .refusal(state.refusal.length() > 0 ? state.refusal.toString() : null)
                    .toolCalls(calls.isEmpty() ? null : calls)
                    .build();
            out.add(ChatResponse.Choice.builder()
                    .index(i)
                    .message(message)
                    .finishReason(state.finishReason)
                    .build());
        }
        return ChatResponse.builder()
                .id(id)
                .model(model)
                .created(created)
                .choices(out)
                .usage(usage)
                .build();
    }

    private ChoiceState choice(int index) {
        while (choices.size() <= index) {
            choices.add(new ChoiceState());
        }
        return choices.get(index);
    }

    private ChoiceState existing(int index) {
        return index >= 0 && index < choices.size() ? choices.get(index) : null;
    }
}
