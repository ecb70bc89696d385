package com.deepansh.gateway.api;

import com.deepansh.gateway.context.CancellableContext;
import com.deepansh.gateway.exception.ErrorBodies;
import com.deepansh.gateway.exception.GatewayException;
import com.deepansh.gateway.model.ResponseObject;
import com.deepansh.gateway.model.ResponseRequest;
import com.deepansh.gateway.response.ResponseService;
import com.deepansh.gateway.stream.ResponseStream;
import com.deepansh.gateway.stream.ResponseStreamEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Responses protocol endpoints.
 *
 * POST   /v1/responses               create; "background": true returns in_progress at once,
 *                                    "stream": true streams lifecycle events over SSE
 * GET    /v1/responses/{id}          wait for and return a background response
 * POST   /v1/responses/{id}/cancel
 * DELETE /v1/responses/{id}
 * POST   /v1/responses/{id}/compact  the response without reasoning items
 */
@RestController
@RequestMapping("/v1/responses")
@Slf4j
public class ResponseController {

    private final ResponseService responseService;
    private final RequestContexts contexts;
    private final ExecutorService ioExecutor;

    public ResponseController(ResponseService responseService, RequestContexts contexts,
                              @Qualifier("gatewayIoExecutor") ExecutorService ioExecutor) {
        this.responseService = responseService;
        this.contexts = contexts;
        this.ioExecutor = ioExecutor;
    }

    @PostMapping(produces = {MediaType.APPLICATION_JSON_VALUE, MediaType.TEXT_EVENT_STREAM_VALUE})
    public Object create(@RequestBody ResponseRequest request) {
        log.info("Create response request [model={}, background={}, stream={}]",
                request.getModel(), request.isBackground(), request.isStreaming());

        if (request.isStreaming()) {
            return stream(request);
        }
        try (CancellableContext ctx = contexts.open()) {
            return ResponseEntity.ok(responseService.create(ctx, request));
        }
    }

    @GetMapping("/{id}")
    public ResponseEntity<ResponseObject> get(@PathVariable String id) {
        try (CancellableContext ctx = contexts.open()) {
            return ResponseEntity.ok(responseService.get(ctx, id));
        }
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<ResponseObject> cancel(@PathVariable String id) {
        try (CancellableContext ctx = contexts.open()) {
            return ResponseEntity.ok(responseService.cancel(ctx, id));
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String id) {
        responseService.delete(id);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", id);
        body.put("object", ResponseObject.OBJECT);
        body.put("deleted", true);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/{id}/compact")
    public ResponseEntity<ResponseObject> compact(@PathVariable String id) {
        try (CancellableContext ctx = contexts.open()) {
            return ResponseEntity.ok(responseService.compact(ctx, id));
        }
    }

    private SseEmitter stream(ResponseRequest request) {
        SseEmitter emitter = new SseEmitter();
        CancellableContext ctx = contexts.open(new SseToolObserver(emitter));
        emitter.onCompletion(ctx::cancel);
        emitter.onTimeout(ctx::cancel);
        emitter.onError(e -> ctx.cancel());

        ioExecutor.execute(() -> pump(ctx, request, emitter));
        return emitter;
    }

    private void pump(CancellableContext ctx, ResponseRequest request, SseEmitter emitter) {
        try (ctx; ResponseStream stream = responseService.stream(ctx, request)) {
            while (stream.next()) {
                ResponseStreamEvent event = stream.current();
                emitter.send(SseEmitter.event()
                        .name(event.type())
                        .data(event.payload(), MediaType.APPLICATION_JSON));
            }
            if (stream.error() != null) {
                log.warn("Response stream ended with error: {}", stream.error().getMessage());
                Map<String, Object> body = new LinkedHashMap<>(ErrorBodies.of(stream.error()));
                body.put("type", "error");
                emitter.send(SseEmitter.event().name("error").data(body, MediaType.APPLICATION_JSON));
            }
            emitter.complete();
        } catch (IOException e) {
            log.debug("Response stream client went away: {}", e.getMessage());
            emitter.completeWithError(e);
        } catch (IllegalStateException e) {
            // emitter already completed by a disconnect or timeout
            log.debug("Response stream emitter closed: {}", e.getMessage());
        } catch (GatewayException | IllegalArgumentException e) {
            log.warn("Response stream failed to start: {}", e.getMessage());
            emitter.completeWithError(e);
        }
    }
}
