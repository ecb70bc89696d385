package com.deepansh.gateway.tool;

/**
 * Outcome of one dispatched call. {@code failed} marks results whose text is a folded error.
 */
public record ToolResult(String callId, String toolName, String text, boolean failed) {
}
