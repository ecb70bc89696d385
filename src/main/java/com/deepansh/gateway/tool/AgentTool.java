package com.deepansh.gateway.tool;

import java.util.Map;

/**
 * A tool implemented inside this process and served by {@link LocalToolProvider}.
 *
 * The {@link #getInputSchema()} map is sent to the model as the JSON Schema of the
 * tool's parameters.
 */
public interface AgentTool {

    /** Unique snake_case name the model uses to invoke this tool */
    String getName();

    /** Primary signal the model uses to decide when to call this tool. */
    String getDescription();

    Map<String, Object> getInputSchema();

    /**
     * Runs the tool. Throw on failure; the loop turns the exception into an
     * {@code Error: ...} result for the model, or ends the turn if configured to.
     */
    String execute(Map<String, Object> arguments) throws Exception;
}
