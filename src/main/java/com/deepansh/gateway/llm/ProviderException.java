package com.deepansh.gateway.llm;

import com.deepansh.gateway.exception.GatewayException;

/**
 * Error reported by a model backend, carrying the backend's own classification.
 * Surfaced as-is for the current round; this layer never retries it.
 */
public class ProviderException extends GatewayException {

    private final int statusCode;
    private final String type;
    private final String code;
    private final String param;

    public ProviderException(int statusCode, String type, String message, String code, String param) {
        super(format(type, message, code));
        this.statusCode = statusCode;
        this.type = type;
        this.code = code;
        this.param = param;
    }

    public static ProviderException rateLimit(String message) {
        return new ProviderException(429, "rate_limit_error", message, "rate_limit_exceeded", null);
    }

    public static ProviderException tokenLimit(String message) {
        return new ProviderException(400, "invalid_request_error", message, "context_length_exceeded", null);
    }

    public static ProviderException invalidRequest(String message) {
        return new ProviderException(400, "invalid_request_error", message, null, null);
    }

    public static ProviderException authentication(String message) {
        return new ProviderException(401, "authentication_error", message, null, null);
    }

    public static ProviderException serverError(String message) {
        return new ProviderException(500, "server_error", message, null, null);
    }

    public boolean isRateLimit() {
        return statusCode == 429 || "rate_limit_exceeded".equals(code);
    }

    public boolean isTokenLimit() {
        return "context_length_exceeded".equals(code) || "max_tokens_exceeded".equals(code);
    }

    public boolean isInvalidRequest() {
        return statusCode == 400 || "invalid_request_error".equals(type);
    }

    public boolean isAuthentication() {
        return statusCode == 401 || "authentication_error".equals(type);
    }

    public boolean isPermission() {
        return statusCode == 403 || "permission_error".equals(type);
    }

    public boolean isNotFound() {
        return statusCode == 404 || "not_found_error".equals(type);
    }

    public boolean isServerError() {
        return statusCode >= 500 || "server_error".equals(type);
    }

    /** Whether a caller could reasonably try again later. Nothing here acts on it. */
    public boolean isRetryable() {
        return isRateLimit() || isServerError();
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getType() {
        return type;
    }

    public String getCode() {
        return code;
    }

    public String getParam() {
        return param;
    }

    @Override
    public String getErrorType() {
        return type != null ? type : "provider_error";
    }

    private static String format(String type, String message, String code) {
        if (code != null && !code.isEmpty()) {
            return "provider: " + type + " (" + code + "): " + message;
        }
        return "provider: " + type + ": " + message;
    }
}
