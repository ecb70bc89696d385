package com.deepansh.gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One conversation entry. The body is either plain text or an ordered list of
 * multimodal parts; on the wire both are carried under {@code content}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    public enum Role {
        system, user, assistant, tool
    }

    private Role role;

    @JsonIgnore
    private String text;

    @JsonIgnore
    private List<ContentPart> parts;

    private String refusal;

    /** Present when role = tool: links back to the assistant's tool_call id */
    @JsonProperty("tool_call_id")
    private String toolCallId;

    private String name;

    /**
     * Present when role = assistant and the model requested tool calls.
     * Echoed back verbatim in later rounds so results can be correlated.
     */
    @JsonProperty("tool_calls")
    private List<ToolCall> toolCalls;

    public static Message system(String text) {
        return Message.builder().role(Role.system).text(text).build();
    }

    public static Message user(String text) {
        return Message.builder().role(Role.user).text(text).build();
    }

    public static Message assistant(String text) {
        return Message.builder().role(Role.assistant).text(text).build();
    }

    public static Message assistantToolCalls(String text, List<ToolCall> calls) {
        return Message.builder().role(Role.assistant).text(text).toolCalls(new ArrayList<>(calls)).build();
    }

    public static Message toolResult(String toolCallId, String text) {
        return Message.builder().role(Role.tool).toolCallId(toolCallId).text(text).build();
    }

    public static Message multimodal(Role role, ContentPart... parts) {
        return Message.builder().role(role).parts(new ArrayList<>(List.of(parts))).build();
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /** Text body, or the concatenation of all text parts for a multimodal message. */
    @JsonIgnore
    public String contentAsText() {
        if (parts == null) {
            return text != null ? text : "";
        }
        StringBuilder sb = new StringBuilder();
        for (ContentPart part : parts) {
            if (part.isText() && part.getText() != null) {
                sb.append(part.getText());
            }
        }
        return sb.toString();
    }

    @JsonProperty("content")
    public Object getContent() {
        return parts != null ? parts : text;
    }

    @JsonProperty("content")
    @SuppressWarnings("unchecked")
    public void setContent(Object content) {
        if (content instanceof List<?> list) {
            List<ContentPart> decoded = new ArrayList<>();
            for (Object item : list) {
                if (item instanceof ContentPart part) {
                    decoded.add(part);
                } else if (item instanceof Map<?, ?> map) {
                    decoded.add(JsonSupport.mapper().convertValue((Map<String, Object>) map, ContentPart.class));
                }
            }
            this.parts = decoded;
            this.text = null;
        } else {
            this.text = content != null ? content.toString() : null;
            this.parts = null;
        }
    }
}
