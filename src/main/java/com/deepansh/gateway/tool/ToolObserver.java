package com.deepansh.gateway.tool;

import com.deepansh.gateway.model.ToolCall;

/**
 * Notified synchronously around every tool dispatch of the loop.
 * Throwing from either method aborts the current turn.
 */
public interface ToolObserver {

    void onCall(ToolCall call) throws Exception;

    void onResult(String callId, String toolName, String result) throws Exception;
}
