package com.deepansh.gateway.tool.impl;

import com.deepansh.gateway.tool.AgentTool;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Returns its input unchanged. Lets the tool loop be exercised end-to-end
 * against a real backend without any external dependency.
 */
@Component
public class EchoTool implements AgentTool {

    @Override
    public String getName() {
        return "echo";
    }

    @Override
    public String getDescription() {
        return "Echoes back the provided message verbatim. Use it to verify that tool calls work.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "message", Map.of(
                                "type", "string",
                                "description", "Text to send back"
                        )
                ),
                "required", List.of("message")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        Object message = arguments.get("message");
        if (message == null) {
            throw new IllegalArgumentException("'message' argument is required");
        }
        return message.toString();
    }
}
