package com.deepansh.gateway.api;

import com.deepansh.gateway.context.CancellableContext;
import com.deepansh.gateway.context.RequestEnvironment;
import com.deepansh.gateway.tool.LocalToolProvider;
import com.deepansh.gateway.tool.ToolObserver;
import org.springframework.stereotype.Component;

/**
 * Builds the execution context of one HTTP request: the registered local tools,
 * plus an optional observer.
 */
@Component
public class RequestContexts {

    private final LocalToolProvider localTools;

    public RequestContexts(LocalToolProvider localTools) {
        this.localTools = localTools;
    }

    public CancellableContext open(ToolObserver observer) {
        RequestEnvironment environment = RequestEnvironment.builder()
                .localProvider(localTools.toolCount() > 0 ? localTools : null)
                .observer(observer)
                .build();
        return CancellableContext.of(environment);
    }

    public CancellableContext open() {
        return open(null);
    }
}
