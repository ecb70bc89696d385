package com.deepansh.gateway.context;

import com.deepansh.gateway.tool.ToolObserver;
import com.deepansh.gateway.tool.ToolProvider;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;
import java.util.Optional;

/**
 * Request-scoped collaborators: the tool providers attached to this request and
 * an optional observer notified around every tool dispatch.
 */
@Getter
@Builder(toBuilder = true)
public class RequestEnvironment {

    private static final RequestEnvironment EMPTY = RequestEnvironment.builder().build();

    /** Unnamespaced provider; receives every call no remote namespace claims */
    private final ToolProvider localProvider;

    @Singular
    private final List<ToolProvider> remoteProviders;

    private final ToolObserver observer;

    public static RequestEnvironment empty() {
        return EMPTY;
    }

    public Optional<ToolProvider> local() {
        return Optional.ofNullable(localProvider);
    }

    public Optional<ToolObserver> toolObserver() {
        return Optional.ofNullable(observer);
    }

    public boolean hasToolProviders() {
        return localProvider != null || !remoteProviders.isEmpty();
    }
}
