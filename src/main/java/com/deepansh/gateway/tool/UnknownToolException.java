package com.deepansh.gateway.tool;

import com.deepansh.gateway.exception.GatewayException;

/**
 * No attached provider owns the requested tool name.
 */
public class UnknownToolException extends GatewayException {

    private final String toolName;

    public UnknownToolException(String toolName) {
        super("no tool provider available for tool: " + toolName);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }

    @Override
    public String getErrorType() {
        return "unknown_tool";
    }
}
