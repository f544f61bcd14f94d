package com.deepansh.orchestrator.tool;

import java.util.Map;

/**
 * Contract every tool must implement.
 *
 * The input schema is declarative metadata shown to the model in the tool listing;
 * nothing validates arguments against it before {@link #execute} runs.
 *
 * A tool reports failure either by returning a string that starts with "ERROR:"
 * or by throwing. The {@link ToolInvoker} turns both into a failed observation,
 * so the state machine can keep going.
 */
public interface AgentTool {

    /** Unique snake_case name the model uses to invoke this tool */
    String getName();

    /** What the tool does and when to use it; shown verbatim in the prompt */
    String getDescription();

    /**
     * JSON Schema (as a Map) describing the tool's input parameters.
     */
    Map<String, Object> getInputSchema();

    /**
     * Execute the tool and return the observation text.
     */
    String execute(Map<String, Object> arguments);
}
