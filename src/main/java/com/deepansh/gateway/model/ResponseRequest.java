package com.deepansh.gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Create request of the Responses protocol.
 *
 * {@code input} is either a bare string (one user message) or a list of typed items;
 * see {@code ResponseConverter} for the accepted item shapes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResponseRequest {

    private String model;
    private Object input;
    private String instructions;
    private List<ToolDescriptor> tools;

    @JsonProperty("background")
    private Boolean background;

    private Boolean stream;

    @JsonProperty("max_output_tokens")
    private Integer maxOutputTokens;

    private Double temperature;

    @JsonProperty("top_p")
    private Double topP;

    private Map<String, String> metadata;

    @JsonIgnore
    public boolean isBackground() {
        return Boolean.TRUE.equals(background);
    }

    @JsonIgnore
    public boolean isStreaming() {
        return Boolean.TRUE.equals(stream);
    }
}
