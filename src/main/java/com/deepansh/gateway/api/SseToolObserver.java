package com.deepansh.gateway.api;

import com.deepansh.gateway.model.JsonSupport;
import com.deepansh.gateway.model.ToolCall;
import com.deepansh.gateway.tool.ToolObserver;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Map;

/**
 * Reports tool progress on an SSE stream as comment frames, which standard SSE
 * clients ignore:
 * <pre>
 * :tool_start:{"tool_call_id":"call_1","tool_name":"echo","status":"running","arguments":{...}}
 * :tool_end:{"tool_call_id":"call_1","tool_name":"echo","status":"complete","result":"..."}
 * </pre>
 * A failed write is logged; the turn goes on.
 */
@Slf4j
public class SseToolObserver implements ToolObserver {

    static final String TOOL_START = "tool_start";
    static final String TOOL_END = "tool_end";
    private static final String ERROR_PREFIX = "Error: ";

    private final SseEmitter emitter;

    public SseToolObserver(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ToolStatusEvent(
            @JsonProperty("tool_call_id") String toolCallId,
            @JsonProperty("tool_name") String toolName,
            String status,
            Map<String, Object> arguments,
            String result,
            String error) {
    }

    @Override
    public void onCall(ToolCall call) {
        write(TOOL_START, new ToolStatusEvent(call.getId(), call.getName(), "running",
                call.getArguments(), null, null));
    }

    @Override
    public void onResult(String callId, String toolName, String result) {
        boolean failed = result != null && result.startsWith(ERROR_PREFIX);
        write(TOOL_END, new ToolStatusEvent(callId, toolName, "complete", null,
                failed ? null : result,
                failed ? result.substring(ERROR_PREFIX.length()) : null));
    }

    private void write(String event, ToolStatusEvent payload) {
        try {
            emitter.send(SseEmitter.event().comment(event + ":" + JsonSupport.write(payload)));
        } catch (IOException | IllegalStateException e) {
            log.warn("Failed to write {} frame for {}: {}", event, payload.toolCallId(), e.getMessage());
        }
    }
}
