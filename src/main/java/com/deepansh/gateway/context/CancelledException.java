package com.deepansh.gateway.context;

import com.deepansh.gateway.exception.GatewayException;

/**
 * Raised at a suspension point once the active context has been cancelled.
 */
public class CancelledException extends GatewayException {

    public CancelledException(String message) {
        super(message);
    }

    @Override
    public String getErrorType() {
        return "cancelled";
    }
}
