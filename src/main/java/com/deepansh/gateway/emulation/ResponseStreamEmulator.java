package com.deepansh.gateway.emulation;

import com.deepansh.gateway.accumulate.CompletionAccumulator;
import com.deepansh.gateway.context.ExecutionContext;
import com.deepansh.gateway.core.ToolLoop;
import com.deepansh.gateway.model.ChatChunk;
import com.deepansh.gateway.model.ChatRequest;
import com.deepansh.gateway.model.ResponseObject;
import com.deepansh.gateway.model.ResponseObject.OutputContent;
import com.deepansh.gateway.model.ResponseObject.OutputItem;
import com.deepansh.gateway.model.ResponseStatus;
import com.deepansh.gateway.model.ToolCall;
import com.deepansh.gateway.model.Usage;
import com.deepansh.gateway.response.ResponseConverter;
import com.deepansh.gateway.response.ResponseIds;
import com.deepansh.gateway.stream.ChatStream;
import com.deepansh.gateway.stream.EventStream;
import com.deepansh.gateway.stream.IncompleteStreamException;
import com.deepansh.gateway.stream.ResponseStreamEvent;
import com.deepansh.gateway.stream.StreamException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Produces the Responses event lifecycle on top of a plain chat stream.
 *
 * A successful turn emits:
 * <pre>
 * response.created
 * response.in_progress
 * response.output_item.added      (empty assistant message)
 * response.content_part.added     (empty output_text part)
 * response.output_text.delta      (zero or more)
 * response.output_text.done
 * response.content_part.done
 * response.output_item.done
 * response.output_item.added/done (one pair per function call, caller-supplied tools only)
 * response.completed              (full response with usage)
 * </pre>
 * Any error ends the sequence early and is thrown to the stream; {@code response.completed}
 * is never emitted after one. Tool rounds run by the loop stay invisible: the consumer
 * only sees the final text.
 */
@Component
@Slf4j
public class ResponseStreamEmulator {

    private final ToolLoop toolLoop;

    public ResponseStreamEmulator(ToolLoop toolLoop) {
        this.toolLoop = toolLoop;
    }

    public void emulate(ExecutionContext ctx, ChatRequest request, String model,
                        EventStream.Sink<ResponseStreamEvent> sink) {
        String responseId = ResponseIds.newResponseId();
        long createdAt = Instant.now().getEpochSecond();
        String itemId = ResponseIds.newMessageItemId();
        Turn turn = new Turn(sink, responseId, model, createdAt);

        if (!turn.lifecycle(ResponseEventTypes.CREATED)
                || !turn.lifecycle(ResponseEventTypes.IN_PROGRESS)
                || !turn.emit(ResponseEventTypes.OUTPUT_ITEM_ADDED, Map.of(
                        "output_index", 0,
                        "item", messageItem(itemId, ResponseStatus.in_progress, null)))
                || !turn.emit(ResponseEventTypes.CONTENT_PART_ADDED, partEvent(itemId, ""))) {
            return;
        }

        CompletionAccumulator completion = new CompletionAccumulator();
        Usage usage = null;
        try (ChatStream chat = toolLoop.stream(ctx, request)) {
            while (chat.next()) {
                ChatChunk chunk = chat.current();
                completion.addChunk(chunk);
                if (chunk.getUsage() != null) {
                    usage = chunk.getUsage();
                }
                String delta = firstDeltaContent(chunk);
                if (delta != null && !delta.isEmpty()) {
                    if (!turn.emit(ResponseEventTypes.OUTPUT_TEXT_DELTA, Map.of(
                            "item_id", itemId,
                            "output_index", 0,
                            "content_index", 0,
                            "delta", delta))) {
                        return;
                    }
                }
            }
            if (chat.error() != null) {
                throw asRuntime(chat.error());
            }
        }

        if (!completion.isComplete()) {
            throw new IncompleteStreamException("chat stream ended without a finish reason");
        }

        String text = completion.content();
        Map<String, Object> textDone = new LinkedHashMap<>();
        textDone.put("item_id", itemId);
        textDone.put("output_index", 0);
        textDone.put("content_index", 0);
        textDone.put("text", text);

        OutputItem finished = ResponseConverter.messageItem(itemId, text);
        if (!turn.emit(ResponseEventTypes.OUTPUT_TEXT_DONE, textDone)
                || !turn.emit(ResponseEventTypes.CONTENT_PART_DONE, partEvent(itemId, text))
                || !turn.emit(ResponseEventTypes.OUTPUT_ITEM_DONE, Map.of("output_index", 0, "item", finished))) {
            return;
        }

        List<OutputItem> output = new ArrayList<>();
        output.add(finished);
        int outputIndex = 1;
        for (ToolCall call : completion.finishedToolCalls().orElse(List.of())) {
            OutputItem item = ResponseConverter.functionCallItem(call);
            if (!turn.emit(ResponseEventTypes.OUTPUT_ITEM_ADDED, Map.of("output_index", outputIndex, "item", item))
                    || !turn.emit(ResponseEventTypes.OUTPUT_ITEM_DONE, Map.of("output_index", outputIndex, "item", item))) {
                return;
            }
            output.add(item);
            outputIndex++;
        }

        ResponseObject response = ResponseObject.builder()
                .id(responseId)
                .createdAt(createdAt)
                .status(ResponseStatus.completed)
                .model(model)
                .output(output)
                .usage(ResponseObject.ResponseUsage.from(usage))
                .build();
        turn.emit(ResponseEventTypes.COMPLETED, Map.of("response", response));
        log.debug("Emulated response completed [id={}, chars={}]", responseId, text.length());
    }

    private static String firstDeltaContent(ChatChunk chunk) {
        if (chunk.getChoices() == null || chunk.getChoices().isEmpty()) {
            return null;
        }
        ChatChunk.Delta delta = chunk.getChoices().get(0).getDelta();
        return delta != null ? delta.getContent() : null;
    }

    private static Map<String, Object> messageItem(String itemId, ResponseStatus status, String text) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("id", itemId);
        item.put("type", OutputItem.TYPE_MESSAGE);
        item.put("role", "assistant");
        item.put("status", status.name());
        item.put("content", text == null ? List.of() : List.of(OutputContent.outputText(text)));
        return item;
    }

    private static Map<String, Object> partEvent(String itemId, String text) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("item_id", itemId);
        payload.put("output_index", 0);
        payload.put("content_index", 0);
        payload.put("part", OutputContent.outputText(text));
        return payload;
    }

    private static RuntimeException asRuntime(Throwable error) {
        if (error instanceof RuntimeException re) {
            return re;
        }
        return new StreamException("streaming error: " + error.getMessage(), error);
    }

    /** Emission state of one turn: every event carries the same response id. */
    private static final class Turn {
        private final EventStream.Sink<ResponseStreamEvent> sink;
        private final String responseId;
        private final String model;
        private final long createdAt;

        private Turn(EventStream.Sink<ResponseStreamEvent> sink, String responseId, String model, long createdAt) {
            this.sink = sink;
            this.responseId = responseId;
            this.model = model;
            this.createdAt = createdAt;
        }

        boolean lifecycle(String type) {
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("id", responseId);
            response.put("object", ResponseObject.OBJECT);
            response.put("status", ResponseStatus.in_progress.name());
            if (model != null) {
                response.put("model", model);
            }
            response.put("created_at", createdAt);
            return emit(type, Map.of("response", response));
        }

        boolean emit(String type, Map<String, Object> payload) {
            return sink.emit(new ResponseStreamEvent(type, payload));
        }
    }
}
