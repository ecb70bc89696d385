package com.deepansh.gateway.tool;

import com.deepansh.gateway.exception.GatewayException;

/**
 * A tool failed while the loop runs with stop-on-first-error.
 */
public class ToolExecutionException extends GatewayException {

    private final String toolName;
    private final String callId;

    public ToolExecutionException(String toolName, String callId, Throwable cause) {
        super("tool " + toolName + " (id: " + callId + ") failed: " + cause.getMessage(), cause);
        this.toolName = toolName;
        this.callId = callId;
    }

    public String getToolName() {
        return toolName;
    }

    public String getCallId() {
        return callId;
    }

    @Override
    public String getErrorType() {
        return "tool_execution_error";
    }
}
