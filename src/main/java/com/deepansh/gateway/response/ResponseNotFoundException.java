package com.deepansh.gateway.response;

import com.deepansh.gateway.exception.GatewayException;

public class ResponseNotFoundException extends GatewayException {

    public ResponseNotFoundException(String id) {
        super("response not found: " + id);
    }

    @Override
    public String getErrorType() {
        return "not_found";
    }
}
