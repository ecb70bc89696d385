package com.deepansh.gateway.tool;

import com.deepansh.gateway.context.CancelledException;
import com.deepansh.gateway.context.ExecutionContext;
import com.deepansh.gateway.context.RequestEnvironment;
import com.deepansh.gateway.model.ToolDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves tool names to the provider that owns them and gathers the tool list
 * offered to the model.
 */
@Component
@Slf4j
public class ToolRouter {

    /**
     * The first remote provider whose namespace prefixes the name, otherwise the local provider.
     *
     * @throws UnknownToolException when neither applies
     */
    public ToolProvider resolve(RequestEnvironment env, String toolName) {
        if (toolName != null) {
            for (ToolProvider remote : env.getRemoteProviders()) {
                String ns = remote.namespace();
                if (ns != null && !ns.isEmpty() && toolName.startsWith(ns)) {
                    return remote;
                }
            }
        }
        return env.local().orElseThrow(() -> new UnknownToolException(toolName));
    }

    /**
     * Tools of every attached provider, local first. A provider that fails to list
     * is logged and left out rather than failing the request.
     */
    public List<ToolDescriptor> collectTools(ExecutionContext ctx) {
        RequestEnvironment env = ctx.environment();
        List<ToolDescriptor> tools = new ArrayList<>();
        env.local().ifPresent(local -> tools.addAll(listSafely(ctx, local)));
        for (ToolProvider remote : env.getRemoteProviders()) {
            tools.addAll(listSafely(ctx, remote));
        }
        return tools;
    }

    private List<ToolDescriptor> listSafely(ExecutionContext ctx, ToolProvider provider) {
        try {
            List<ToolDescriptor> listed = provider.listTools(ctx);
            return listed != null ? listed : List.of();
        } catch (CancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Failed to list tools [namespace='{}']: {}", provider.namespace(), e.getMessage());
            return List.of();
        }
    }
}
