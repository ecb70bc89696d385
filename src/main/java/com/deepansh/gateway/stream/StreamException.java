package com.deepansh.gateway.stream;

import com.deepansh.gateway.exception.GatewayException;

/**
 * A stream was interrupted after it started delivering events.
 */
public class StreamException extends GatewayException {

    public StreamException(String message) {
        super(message);
    }

    public StreamException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorType() {
        return "stream_error";
    }
}
