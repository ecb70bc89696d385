package com.deepansh.gateway.exception;

/**
 * Root of every error the gateway raises on purpose. Anything else reaching the
 * web layer is treated as an unexpected fault.
 */
public class GatewayException extends RuntimeException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Short machine-readable category rendered in error bodies. */
    public String getErrorType() {
        return "gateway_error";
    }
}
