package com.deepansh.gateway.exception;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error body shared by JSON responses and in-stream error frames:
 * {@code {"error": {"type": ..., "message": ...}, "timestamp": ...}}.
 */
public final class ErrorBodies {

    private ErrorBodies() {
    }

    public static Map<String, Object> of(String type, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("type", type);
        error.put("message", message);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("timestamp", Instant.now().toString());
        return body;
    }

    public static Map<String, Object> of(Throwable error) {
        if (error instanceof GatewayException ge) {
            return of(ge.getErrorType(), ge.getMessage());
        }
        return of("server_error", error.getMessage() != null ? error.getMessage() : "internal error");
    }
}
