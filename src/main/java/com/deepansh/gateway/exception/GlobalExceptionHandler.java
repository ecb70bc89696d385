package com.deepansh.gateway.exception;

import com.deepansh.gateway.context.CancelledException;
import com.deepansh.gateway.core.LoopExhaustedException;
import com.deepansh.gateway.llm.ProviderException;
import com.deepansh.gateway.response.ResponseNotFoundException;
import com.deepansh.gateway.response.ResponseTimeoutException;
import com.deepansh.gateway.stream.StreamException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ProviderException.class)
    public ResponseEntity<Map<String, Object>> handleProvider(ProviderException ex) {
        log.error("Provider error [status={}, type={}]: {}", ex.getStatusCode(), ex.getType(), ex.getMessage());
        Map<String, Object> body = ErrorBodies.of(ex.getErrorType(), ex.getMessage());
        if (ex.getCode() != null) {
            @SuppressWarnings("unchecked")
            Map<String, Object> error = (Map<String, Object>) body.get("error");
            error.put("code", ex.getCode());
        }
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    @ExceptionHandler(ResponseNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResponseNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBodies.of(ex));
    }

    @ExceptionHandler(ResponseTimeoutException.class)
    public ResponseEntity<Map<String, Object>> handleTimeout(ResponseTimeoutException ex) {
        log.warn(ex.getMessage());
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(ErrorBodies.of(ex));
    }

    @ExceptionHandler(StreamException.class)
    public ResponseEntity<Map<String, Object>> handleStream(StreamException ex) {
        log.error("Stream error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ErrorBodies.of(ex));
    }

    @ExceptionHandler(CancelledException.class)
    public ResponseEntity<Map<String, Object>> handleCancelled(CancelledException ex) {
        log.warn("Request cancelled: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorBodies.of(ex));
    }

    @ExceptionHandler(LoopExhaustedException.class)
    public ResponseEntity<Map<String, Object>> handleLoopExhausted(LoopExhaustedException ex) {
        log.error("Tool loop did not converge in {} rounds", ex.getMaxRounds());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorBodies.of(ex));
    }

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<Map<String, Object>> handleGateway(GatewayException ex) {
        log.error("Gateway error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorBodies.of(ex));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String msg = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .findFirst()
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBodies.of("invalid_request_error", msg));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        return ResponseEntity.badRequest().body(ErrorBodies.of("invalid_request_error", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneral(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorBodies.of("server_error", "An unexpected error occurred"));
    }
}
