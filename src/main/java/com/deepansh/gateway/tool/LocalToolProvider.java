package com.deepansh.gateway.tool;

import com.deepansh.gateway.context.ExecutionContext;
import com.deepansh.gateway.model.ToolDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unnamespaced provider serving every {@link AgentTool} bean in the context.
 *
 * Spring injects all AgentTool components; they are indexed by name for dispatch.
 */
@Component
@Slf4j
public class LocalToolProvider implements ToolProvider {

    private final Map<String, AgentTool> tools = new LinkedHashMap<>();

    public LocalToolProvider(List<AgentTool> toolBeans) {
        toolBeans.forEach(tool -> {
            AgentTool previous = tools.put(tool.getName(), tool);
            if (previous != null) {
                log.warn("Tool [{}] registered twice, keeping {}", tool.getName(), tool.getClass().getSimpleName());
            }
            log.info("Registered local tool: [{}]", tool.getName());
        });
        log.info("Total local tools registered: {}", tools.size());
    }

    @Override
    public String namespace() {
        return "";
    }

    @Override
    public List<ToolDescriptor> listTools(ExecutionContext ctx) {
        return tools.values().stream()
                .map(tool -> ToolDescriptor.builder()
                        .name(tool.getName())
                        .description(tool.getDescription())
                        .parameters(tool.getInputSchema())
                        .build())
                .toList();
    }

    @Override
    public String callTool(ExecutionContext ctx, String name, Map<String, Object> arguments) throws Exception {
        AgentTool tool = tools.get(name);
        if (tool == null) {
            throw new UnknownToolException(name);
        }
        log.debug("Executing local tool: [{}] with args: {}", name, arguments);
        return tool.execute(arguments != null ? arguments : Map.of());
    }

    public boolean hasTool(String name) {
        return tools.containsKey(name);
    }

    public int toolCount() {
        return tools.size();
    }
}
