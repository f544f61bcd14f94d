package com.deepansh.orchestrator.policy;

import com.deepansh.orchestrator.model.ToolCall;

import java.util.Set;

/**
 * Rejects any action whose tool is not on the allowlist. An empty allowlist rejects everything.
 */
public class ToolAllowlistPolicy implements AgentPolicy {

    private final Set<String> allowedTools;

    public ToolAllowlistPolicy(Set<String> allowedTools) {
        this.allowedTools = Set.copyOf(allowedTools);
    }

    @Override
    public String getName() {
        return "tool_allowlist";
    }

    @Override
    public PolicyDecision validateAction(ToolCall action) {
        if (allowedTools.contains(action.getToolName())) {
            return PolicyDecision.allow();
        }
        return PolicyDecision.reject("tool '" + action.getToolName() + "' is not in the allowed list " + allowedTools);
    }
}
