package com.deepansh.orchestrator.policy;

import com.deepansh.orchestrator.model.ToolCall;

/**
 * Gate applied to every proposed tool action (before execution) and to the final
 * response of every run. Policies must be stateless with respect to any single run.
 */
public interface AgentPolicy {

    String getName();

    default PolicyDecision validateAction(ToolCall action) {
        return PolicyDecision.allow();
    }

    default String filterResponse(String response) {
        return response;
    }
}
