package com.deepansh.gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A complete (non-streamed) chat completion.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatResponse {

    private String id;

    @Builder.Default
    private String object = "chat.completion";

    private long created;
    private String model;

    @Builder.Default
    private List<Choice> choices = new ArrayList<>();

    private Usage usage;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Choice {
        private int index;
        private Message message;

        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @JsonIgnore
    public Choice firstChoice() {
        return choices == null || choices.isEmpty() ? null : choices.get(0);
    }

    @JsonIgnore
    public Message firstMessage() {
        Choice choice = firstChoice();
        return choice != null ? choice.getMessage() : null;
    }

    /** Tool calls of the first choice, never null. */
    @JsonIgnore
    public List<ToolCall> toolCalls() {
        Message message = firstMessage();
        return message != null && message.getToolCalls() != null ? message.getToolCalls() : List.of();
    }
}
