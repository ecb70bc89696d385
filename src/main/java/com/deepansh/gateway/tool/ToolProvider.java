package com.deepansh.gateway.tool;

import com.deepansh.gateway.context.ExecutionContext;
import com.deepansh.gateway.model.ToolDescriptor;

import java.util.List;
import java.util.Map;

/**
 * Source of executable tools attached to a request.
 *
 * A request carries at most one local provider (empty namespace) and any number of
 * remote providers. A remote provider advertises names that start with its namespace;
 * the namespace is only used to route calls back to it.
 */
public interface ToolProvider {

    /** Name prefix owned by this provider; empty for the local provider. */
    String namespace();

    List<ToolDescriptor> listTools(ExecutionContext ctx);

    /**
     * Runs one tool and returns its textual result.
     * A failure is reported by throwing; the caller decides whether it ends the turn.
     */
    String callTool(ExecutionContext ctx, String name, Map<String, Object> arguments) throws Exception;
}
