package com.deepansh.gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatRequest {

    private String model;

    @NotEmpty(message = "messages must not be empty")
    @Valid
    private List<Message> messages;

    /** Tools supplied by the caller. When present, the caller executes them itself. */
    private List<ToolDescriptor> tools;

    @JsonProperty("tool_choice")
    private Object toolChoice;

    @JsonProperty("max_tokens")
    private Integer maxTokens;

    @JsonProperty("max_completion_tokens")
    private Integer maxCompletionTokens;

    private Double temperature;

    @JsonProperty("top_p")
    private Double topP;

    private Boolean stream;

    @JsonProperty("stream_options")
    private StreamOptions streamOptions;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StreamOptions {
        @JsonProperty("include_usage")
        private boolean includeUsage;
    }

    public boolean hasTools() {
        return tools != null && !tools.isEmpty();
    }

    @JsonIgnore
    public boolean isStreaming() {
        return Boolean.TRUE.equals(stream);
    }

    /** Copy whose message list can be appended to without touching this request. */
    public ChatRequest copy() {
        return toBuilder()
                .messages(messages != null ? new ArrayList<>(messages) : new ArrayList<>())
                .tools(tools != null ? new ArrayList<>(tools) : null)
                .build();
    }
}
