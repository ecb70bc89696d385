package com.deepansh.gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A complete function invocation requested by the model.
 *
 * On the wire the arguments travel as a JSON string nested under
 * {@code function}; in memory they are a parsed mapping.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolCall {

    public static final String TYPE_FUNCTION = "function";

    /** Must be echoed back in the tool result message */
    private String id;

    @Builder.Default
    private String type = TYPE_FUNCTION;

    /** Position of the call in the assistant message; only meaningful while streaming */
    private Integer index;

    @JsonIgnore
    private String name;

    @JsonIgnore
    @Builder.Default
    private Map<String, Object> arguments = new LinkedHashMap<>();

    @JsonProperty("function")
    public Map<String, Object> getFunction() {
        Map<String, Object> fn = new LinkedHashMap<>();
        fn.put("name", name);
        fn.put("arguments", JsonSupport.writeArguments(arguments));
        return fn;
    }

    @JsonProperty("function")
    public void setFunction(Map<String, Object> fn) {
        if (fn == null) {
            return;
        }
        Object fnName = fn.get("name");
        this.name = fnName != null ? fnName.toString() : null;
        Object args = fn.get("arguments");
        if (args instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), v));
            this.arguments = copy;
        } else {
            this.arguments = JsonSupport.parseArguments(args != null ? args.toString() : null);
        }
    }
}
