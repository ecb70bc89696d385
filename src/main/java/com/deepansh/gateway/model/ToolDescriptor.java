package com.deepansh.gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Schema of a tool offered to the model, serialized in the function-calling shape
 * {@code {"type":"function","function":{"name","description","parameters"}}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolDescriptor {

    @JsonIgnore
    private String name;

    @JsonIgnore
    private String description;

    @JsonIgnore
    private Map<String, Object> parameters;

    @JsonProperty("type")
    public String getType() {
        return ToolCall.TYPE_FUNCTION;
    }

    @JsonProperty("type")
    public void setType(String ignored) {
        // always "function"
    }

    @JsonProperty("function")
    public Map<String, Object> getFunction() {
        Map<String, Object> fn = new LinkedHashMap<>();
        fn.put("name", name);
        if (description != null) {
            fn.put("description", description);
        }
        fn.put("parameters", parameters != null ? parameters : Map.of("type", "object", "properties", Map.of()));
        return fn;
    }

    @JsonProperty("function")
    @SuppressWarnings("unchecked")
    public void setFunction(Map<String, Object> fn) {
        if (fn == null) {
            return;
        }
        this.name = (String) fn.get("name");
        this.description = (String) fn.get("description");
        Object params = fn.get("parameters");
        this.parameters = params instanceof Map<?, ?> ? (Map<String, Object>) params : null;
    }
}
