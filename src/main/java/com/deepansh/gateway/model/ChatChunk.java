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
 * One incremental fragment of a streamed chat completion.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatChunk {

    public static final String FINISH_STOP = "stop";
    public static final String FINISH_TOOL_CALLS = "tool_calls";
    public static final String FINISH_LENGTH = "length";

    private String id;

    @Builder.Default
    private String object = "chat.completion.chunk";

    private long created;
    private String model;

    @Builder.Default
    private List<Choice> choices = new ArrayList<>();

    /** Usually only present on the trailing chunk */
    private Usage usage;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Choice {
        private int index;

        @Builder.Default
        private Delta delta = new Delta();

        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Delta {
        private String role;
        private String content;
        private String refusal;

        @JsonProperty("reasoning_content")
        private String reasoningContent;

        @JsonProperty("tool_calls")
        private List<ToolCallDelta> toolCalls;

        @JsonIgnore
        public boolean hasToolCalls() {
            return toolCalls != null && !toolCalls.isEmpty();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ToolCallDelta {
        private int index;
        private String id;
        private String type;
        private FunctionDelta function;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FunctionDelta {
        private String name;
        /** A fragment of the argument JSON text */
        private String arguments;
    }

    public static ChatChunk usageOnly(String id, String model, long created, Usage usage) {
        return ChatChunk.builder().id(id).model(model).created(created)
                .choices(new ArrayList<>()).usage(usage).build();
    }

    @JsonIgnore
    public boolean carriesToolCalls() {
        if (choices == null) {
            return false;
        }
        for (Choice choice : choices) {
            if (choice.getDelta() != null && choice.getDelta().hasToolCalls()) {
                return true;
            }
            if (FINISH_TOOL_CALLS.equals(choice.getFinishReason())) {
                return true;
            }
        }
        return false;
    }
}
