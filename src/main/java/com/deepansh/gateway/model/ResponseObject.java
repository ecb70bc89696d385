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
import java.util.Map;

/**
 * Response object of the Responses protocol, as returned by create/get and
 * carried by lifecycle stream events.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResponseObject {

    public static final String OBJECT = "response";

    private String id;

    @Builder.Default
    private String object = OBJECT;

    @JsonProperty("created_at")
    private long createdAt;

    private ResponseStatus status;
    private ResponseError error;
    private String model;
    private List<OutputItem> output;
    private ResponseUsage usage;
    private Map<String, String> metadata;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ResponseError {
        private String type;
        private String code;
        private String message;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ResponseUsage {
        @JsonProperty("input_tokens")
        private int inputTokens;

        @JsonProperty("output_tokens")
        private int outputTokens;

        @JsonProperty("total_tokens")
        private int totalTokens;

        public static ResponseUsage from(Usage usage) {
            Usage u = usage != null ? usage : Usage.ZERO;
            return new ResponseUsage(u.promptTokens(), u.completionTokens(), u.totalTokens());
        }
    }

    /**
     * One output entry: an assistant {@code message}, a {@code function_call}
     * or a {@code reasoning} item.
     */
    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OutputItem {
        public static final String TYPE_MESSAGE = "message";
        public static final String TYPE_FUNCTION_CALL = "function_call";
        public static final String TYPE_REASONING = "reasoning";

        private String id;
        private String type;
        private String role;
        private String status;
        private List<OutputContent> content;

        @JsonProperty("call_id")
        private String callId;

        private String name;
        private String arguments;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OutputContent {
        public static final String TYPE_OUTPUT_TEXT = "output_text";

        private String type;
        private String text;
        private List<Object> annotations;

        public static OutputContent outputText(String text) {
            return new OutputContent(TYPE_OUTPUT_TEXT, text, new ArrayList<>());
        }
    }

    /** Concatenated text of every output_text part, in order. */
    @JsonIgnore
    public String outputText() {
        StringBuilder sb = new StringBuilder();
        if (output == null) {
            return "";
        }
        for (OutputItem item : output) {
            if (item.getContent() == null) {
                continue;
            }
            for (OutputContent part : item.getContent()) {
                if (OutputContent.TYPE_OUTPUT_TEXT.equals(part.getType()) && part.getText() != null) {
                    sb.append(part.getText());
                }
            }
        }
        return sb.toString();
    }
}
