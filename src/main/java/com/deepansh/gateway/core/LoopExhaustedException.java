package com.deepansh.gateway.core;

import com.deepansh.gateway.exception.GatewayException;

/**
 * The model kept requesting tools for the whole round budget without finishing.
 * Fatal for the turn and never retried.
 */
public class LoopExhaustedException extends GatewayException {

    private final int maxRounds;

    public LoopExhaustedException(int maxRounds) {
        super(String.format("maximum tool call iterations (%d) reached", maxRounds));
        this.maxRounds = maxRounds;
    }

    public int getMaxRounds() {
        return maxRounds;
    }

    @Override
    public String getErrorType() {
        return "max_tool_iterations";
    }
}
