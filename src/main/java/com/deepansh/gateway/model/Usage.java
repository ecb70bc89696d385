package com.deepansh.gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Token accounting for one or more rounds. The total is always derived,
 * never stored, so it stays equal to prompt + completion after any combination.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Usage(
        @JsonProperty("prompt_tokens") int promptTokens,
        @JsonProperty("completion_tokens") int completionTokens
) {

    public static final Usage ZERO = new Usage(0, 0);

    @JsonProperty("total_tokens")
    public int totalTokens() {
        return promptTokens + completionTokens;
    }

    /** Null-tolerant sum; a null operand counts as zero. */
    public Usage plus(Usage other) {
        if (other == null) {
            return this;
        }
        return new Usage(promptTokens + other.promptTokens, completionTokens + other.completionTokens);
    }

    public static Usage sum(Usage a, Usage b) {
        return (a != null ? a : ZERO).plus(b);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return promptTokens == 0 && completionTokens == 0;
    }
}
