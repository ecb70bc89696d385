package com.deepansh.gateway.tool;

import com.deepansh.gateway.config.GatewayProperties;
import com.deepansh.gateway.context.CancelledException;
import com.deepansh.gateway.context.ExecutionContext;
import com.deepansh.gateway.context.Suspensions;
import com.deepansh.gateway.model.ToolCall;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * Dispatches tool calls to their providers and notifies the request's observer.
 *
 * A failing tool is folded into its result as {@code "Error: <message>"} so the model
 * can see it and recover, unless stop-on-first-error is set, in which case the failure
 * ends the turn as a {@link ToolExecutionException}. Observer failures always end it.
 */
@Component
@Slf4j
public class ToolExecutor {

    private final ToolRouter router;
    private final ExecutorService ioExecutor;
    private final boolean stopOnFirstError;

    @Autowired
    public ToolExecutor(ToolRouter router,
                        @Qualifier("gatewayIoExecutor") ExecutorService ioExecutor,
                        GatewayProperties properties) {
        this(router, ioExecutor, properties.getLoop().isStopOnFirstError());
    }

    public ToolExecutor(ToolRouter router, ExecutorService ioExecutor, boolean stopOnFirstError) {
        this.router = router;
        this.ioExecutor = ioExecutor;
        this.stopOnFirstError = stopOnFirstError;
    }

    /** Executes calls in order; each result lines up with its call. */
    public List<ToolResult> executeAll(ExecutionContext ctx, List<ToolCall> calls) {
        List<ToolResult> results = new ArrayList<>(calls.size());
        for (ToolCall call : calls) {
            results.add(execute(ctx, call));
        }
        return results;
    }

    public ToolResult execute(ExecutionContext ctx, ToolCall call) {
        Optional<ToolObserver> observer = ctx.environment().toolObserver();
        if (observer.isPresent()) {
            try {
                observer.get().onCall(call);
            } catch (Exception e) {
                throw new ObserverException(e);
            }
        }

        String text;
        boolean failed = false;
        try {
            ToolProvider provider = router.resolve(ctx.environment(), call.getName());
            log.info("Dispatching tool [{}] [id={}, namespace='{}']", call.getName(), call.getId(), provider.namespace());
            text = Suspensions.await(ctx, ioExecutor,
                    () -> provider.callTool(ctx, call.getName(), call.getArguments()));
            if (text == null) {
                text = "";
            }
        } catch (CancelledException e) {
            throw e;
        } catch (Exception e) {
            if (stopOnFirstError) {
                throw new ToolExecutionException(call.getName(), call.getId(), e);
            }
            log.warn("Tool [{}] failed [id={}]: {}", call.getName(), call.getId(), e.getMessage());
            text = "Error: " + e.getMessage();
            failed = true;
        }

        if (observer.isPresent()) {
            try {
                observer.get().onResult(call.getId(), call.getName(), text);
            } catch (Exception e) {
                throw new ObserverException(e);
            }
        }
        return new ToolResult(call.getId(), call.getName(), text, failed);
    }
}
