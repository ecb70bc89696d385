package com.deepansh.gateway.stream;

/**
 * The upstream chat stream ended cleanly but never reported a terminal finish reason.
 */
public class IncompleteStreamException extends StreamException {

    public IncompleteStreamException(String message) {
        super(message);
    }
}
