package com.deepansh.gateway.response;

import com.deepansh.gateway.exception.GatewayException;

/**
 * A blocking retrieval gave up waiting. The response itself keeps running.
 */
public class ResponseTimeoutException extends GatewayException {

    public ResponseTimeoutException(String id) {
        super("timeout waiting for response: " + id);
    }

    @Override
    public String getErrorType() {
        return "timeout";
    }
}
