package com.deepansh.gateway.tool;

import com.deepansh.gateway.exception.GatewayException;

public class ObserverException extends GatewayException {

    public ObserverException(Throwable cause) {
        super("tool handler error: " + cause.getMessage(), cause);
    }

    @Override
    public String getErrorType() {
        return "tool_observer_error";
    }
}
