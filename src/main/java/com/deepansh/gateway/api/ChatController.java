package com.deepansh.gateway.api;

import com.deepansh.gateway.context.CancellableContext;
import com.deepansh.gateway.core.ToolLoop;
import com.deepansh.gateway.exception.ErrorBodies;
import com.deepansh.gateway.exception.GatewayException;
import com.deepansh.gateway.model.ChatChunk;
import com.deepansh.gateway.model.ChatRequest;
import com.deepansh.gateway.model.ChatResponse;
import com.deepansh.gateway.stream.ChatStream;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Chat completions endpoint.
 *
 * POST /v1/chat/completions
 *   "stream": true switches to an SSE stream of chunks terminated by {@code data: [DONE]};
 *   tool progress arrives as comment frames (see {@link SseToolObserver}).
 *
 * GET /v1/health
 */
@RestController
@RequestMapping("/v1")
@Slf4j
public class ChatController {

    static final String DONE = "[DONE]";

    private final ToolLoop toolLoop;
    private final RequestContexts contexts;
    private final ExecutorService ioExecutor;

    public ChatController(ToolLoop toolLoop, RequestContexts contexts,
                          @Qualifier("gatewayIoExecutor") ExecutorService ioExecutor) {
        this.toolLoop = toolLoop;
        this.contexts = contexts;
        this.ioExecutor = ioExecutor;
    }

    @PostMapping(value = "/chat/completions", produces = {MediaType.APPLICATION_JSON_VALUE, MediaType.TEXT_EVENT_STREAM_VALUE})
    public Object chatCompletions(@Valid @RequestBody ChatRequest request) {
        log.info("Chat completion request [model={}, messages={}, stream={}]",
                request.getModel(), request.getMessages().size(), request.isStreaming());

        if (request.isStreaming()) {
            return stream(request);
        }
        try (CancellableContext ctx = contexts.open()) {
            ChatResponse response = toolLoop.complete(ctx, request);
            return ResponseEntity.ok(response);
        }
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    private SseEmitter stream(ChatRequest request) {
        SseEmitter emitter = new SseEmitter();
        CancellableContext ctx = contexts.open(new SseToolObserver(emitter));
        emitter.onCompletion(ctx::cancel);
        emitter.onTimeout(ctx::cancel);
        emitter.onError(e -> ctx.cancel());

        ioExecutor.execute(() -> pump(ctx, request, emitter));
        return emitter;
    }

    private void pump(CancellableContext ctx, ChatRequest request, SseEmitter emitter) {
        try (ctx; ChatStream stream = toolLoop.stream(ctx, request)) {
            while (stream.next()) {
                ChatChunk chunk = stream.current();
                emitter.send(SseEmitter.event().data(chunk, MediaType.APPLICATION_JSON));
            }
            if (stream.error() != null) {
                log.warn("Chat stream ended with error: {}", stream.error().getMessage());
                emitter.send(SseEmitter.event().data(ErrorBodies.of(stream.error()), MediaType.APPLICATION_JSON));
            }
            emitter.send(SseEmitter.event().data(DONE));
            emitter.complete();
        } catch (IOException e) {
            log.debug("Chat stream client went away: {}", e.getMessage());
            emitter.completeWithError(e);
        } catch (IllegalStateException e) {
            // emitter already completed by a disconnect or timeout
            log.debug("Chat stream emitter closed: {}", e.getMessage());
        } catch (GatewayException e) {
            log.warn("Chat stream failed to start: {}", e.getMessage());
            emitter.completeWithError(e);
        }
    }
}
