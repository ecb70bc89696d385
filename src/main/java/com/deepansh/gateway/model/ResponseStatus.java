package com.deepansh.gateway.model;

/**
 * Lifecycle of an asynchronous response. Every status but the first two is terminal.
 */
public enum ResponseStatus {
    queued, in_progress, completed, failed, cancelled;

    public boolean isTerminal() {
        return this == completed || this == failed || this == cancelled;
    }
}
