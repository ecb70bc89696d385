package com.deepansh.gateway.response;

import com.deepansh.gateway.config.GatewayProperties;
import com.deepansh.gateway.context.CancellationToken;
import com.deepansh.gateway.context.CancelledException;
import com.deepansh.gateway.context.DetachedContext;
import com.deepansh.gateway.context.ExecutionContext;
import com.deepansh.gateway.core.ToolLoop;
import com.deepansh.gateway.emulation.ResponseStreamEmulator;
import com.deepansh.gateway.exception.GatewayException;
import com.deepansh.gateway.llm.ProviderException;
import com.deepansh.gateway.model.ChatRequest;
import com.deepansh.gateway.model.ChatResponse;
import com.deepansh.gateway.model.ResponseObject;
import com.deepansh.gateway.model.ResponseRequest;
import com.deepansh.gateway.model.ResponseStatus;
import com.deepansh.gateway.stream.ResponseStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Responses protocol on top of the tool loop.
 *
 * Background creates register a {@link ResponseState} and run the turn on
 * {@code responseTaskExecutor} under a detached context, so the HTTP request that
 * started it may go away. Readers reattach with {@link #get}.
 */
@Service
@Slf4j
public class ResponseService {

    private final ToolLoop toolLoop;
    private final ResponseManager manager;
    private final ResponseConverter converter;
    private final ResponseStreamEmulator emulator;
    private final TaskExecutor taskExecutor;
    private final ExecutorService ioExecutor;
    private final Clock clock;

    private final Duration backgroundTimeout;
    private final Duration pollInterval;
    private final Duration waitTimeout;
    private final int bufferCapacity;

    @Autowired
    public ResponseService(ToolLoop toolLoop,
                           ResponseManager manager,
                           ResponseConverter converter,
                           ResponseStreamEmulator emulator,
                           @Qualifier("responseTaskExecutor") TaskExecutor taskExecutor,
                           @Qualifier("gatewayIoExecutor") ExecutorService ioExecutor,
                           GatewayProperties properties) {
        this(toolLoop, manager, converter, emulator, taskExecutor, ioExecutor, Clock.systemUTC(),
                properties.getProvider().getRequestTimeout(),
                properties.getResponses().getPollInterval(),
                properties.getResponses().getWaitTimeout(),
                properties.getStream().getBufferCapacity());
    }

    public ResponseService(ToolLoop toolLoop, ResponseManager manager, ResponseConverter converter,
                           ResponseStreamEmulator emulator, TaskExecutor taskExecutor, ExecutorService ioExecutor,
                           Clock clock, Duration backgroundTimeout, Duration pollInterval, Duration waitTimeout,
                           int bufferCapacity) {
        this.toolLoop = toolLoop;
        this.manager = manager;
        this.converter = converter;
        this.emulator = emulator;
        this.taskExecutor = taskExecutor;
        this.ioExecutor = ioExecutor;
        this.clock = clock;
        this.backgroundTimeout = backgroundTimeout;
        this.pollInterval = pollInterval;
        this.waitTimeout = waitTimeout;
        this.bufferCapacity = bufferCapacity;
    }

    /**
     * Runs the turn in the background and returns an in_progress placeholder, or runs
     * it inline and returns the completed response.
     */
    public ResponseObject create(ExecutionContext ctx, ResponseRequest request) {
        ChatRequest chatRequest = converter.toChatRequest(request);
        if (request.isBackground()) {
            return createInBackground(ctx, chatRequest, request.getModel());
        }
        ChatResponse chat = toolLoop.complete(ctx, chatRequest);
        return converter.toResponseObject(chat, ResponseIds.newResponseId(), request.getModel(), now());
    }

    /**
     * Waits for the response to end, polling at a fixed interval up to the wait ceiling.
     *
     * @throws ResponseNotFoundException if no such response is registered
     * @throws ResponseTimeoutException if it is still running at the ceiling
     * @throws CancelledException if the caller's context is cancelled while waiting
     */
    public ResponseObject get(ExecutionContext ctx, String id) {
        ResponseState state = manager.get(id).orElseThrow(() -> new ResponseNotFoundException(id));
        Instant giveUpAt = clock.instant().plus(waitTimeout);

        // one view and one cancel hook per wait; slices block on the view directly
        CompletableFuture<ResponseStatus> done = state.whenTerminal();
        try (CancellationToken.Registration ignored = ctx.cancellation().onCancel(() -> done.cancel(false))) {
            while (!state.isTerminal()) {
                ctx.throwIfCancelled();
                Duration remaining = Duration.between(clock.instant(), giveUpAt);
                if (remaining.isNegative() || remaining.isZero()) {
                    throw new ResponseTimeoutException(id);
                }
                Duration slice = remaining.compareTo(pollInterval) < 0 ? remaining : pollInterval;
                try {
                    done.get(slice.toMillis(), TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    log.trace("Response {} still running", id);
                } catch (CancellationException e) {
                    ctx.throwIfCancelled();
                } catch (ExecutionException e) {
                    throw new IllegalStateException("response state failed for " + id, e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CancelledException("interrupted while waiting for " + id);
                }
            }
        }
        return render(state);
    }

    /** Cancels the response and returns its final form. */
    public ResponseObject cancel(ExecutionContext ctx, String id) {
        manager.cancel(id);
        return get(ctx, id);
    }

    public void delete(String id) {
        manager.delete(id);
    }

    /** The response without its reasoning output items. */
    public ResponseObject compact(ExecutionContext ctx, String id) {
        ResponseObject response = get(ctx, id);
        if (response.getOutput() == null) {
            return response;
        }
        return response.toBuilder()
                .output(response.getOutput().stream()
                        .filter(item -> !ResponseObject.OutputItem.TYPE_REASONING.equals(item.getType()))
                        .toList())
                .build();
    }

    /** Streams the turn as Responses protocol events. */
    public ResponseStream stream(ExecutionContext ctx, ResponseRequest request) {
        ChatRequest chatRequest = converter.toChatRequest(request);
        return ResponseStream.start(ctx, ioExecutor, bufferCapacity,
                (producerCtx, sink) -> emulator.emulate(producerCtx, chatRequest, request.getModel(), sink));
    }

    private ResponseObject createInBackground(ExecutionContext ctx, ChatRequest chatRequest, String model) {
        DetachedContext background = DetachedContext.detach(ctx, backgroundTimeout);
        ResponseState state = manager.create(background::cancel);
        long createdAt = now();

        try {
            taskExecutor.execute(() -> runInBackground(background, state, chatRequest, model, createdAt));
        } catch (TaskRejectedException e) {
            log.error("Background response rejected [id={}]: {}", state.getId(), e.getMessage());
            state.setError(new GatewayException("background executor rejected the response", e));
            background.close();
        }

        log.info("Background response created [id={}]", state.getId());
        return ResponseObject.builder()
                .id(state.getId())
                .createdAt(createdAt)
                .status(ResponseStatus.in_progress)
                .model(model)
                .build();
    }

    private void runInBackground(DetachedContext background, ResponseState state, ChatRequest chatRequest,
                                 String model, long createdAt) {
        try (background) {
            ChatResponse chat = toolLoop.complete(background, chatRequest);
            if (state.setResult(converter.toResponseObject(chat, state.getId(), model, createdAt))) {
                log.info("Background response completed [id={}]", state.getId());
            }
        } catch (Throwable t) {
            if (state.setError(t)) {
                log.error("Background response failed [id={}]: {}", state.getId(), t.getMessage(), t);
            } else {
                log.debug("Background response {} ended after it was {}: {}",
                        state.getId(), state.getStatus(), t.getMessage());
            }
        }
    }

    private ResponseObject render(ResponseState state) {
        ResponseStatus status = state.getStatus();
        if (status == ResponseStatus.completed && state.getResult() != null) {
            return state.getResult();
        }
        ResponseObject.ResponseObjectBuilder response = ResponseObject.builder()
                .id(state.getId())
                .createdAt(state.getCreatedAt().getEpochSecond())
                .status(status);
        if (status == ResponseStatus.failed) {
            response.error(toError(state.getError()));
        }
        return response.build();
    }

    static ResponseObject.ResponseError toError(Throwable error) {
        if (error instanceof ProviderException pe) {
            return new ResponseObject.ResponseError(pe.getErrorType(), pe.getCode(), pe.getMessage());
        }
        if (error instanceof GatewayException ge) {
            return new ResponseObject.ResponseError(ge.getErrorType(), null, ge.getMessage());
        }
        String message = error != null && error.getMessage() != null ? error.getMessage() : "internal error";
        return new ResponseObject.ResponseError("server_error", null, message);
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
