package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.observability.RunContext;
import com.deepansh.orchestrator.tool.ToolDefinition;
import com.deepansh.orchestrator.tool.ToolInvoker;
import com.deepansh.orchestrator.tool.ToolRegistry;
import lombok.Builder;
import lombok.Value;

import java.util.stream.Collectors;

/**
 * Everything a step may use besides the state itself. Built fresh for every run.
 */
@Value
@Builder
public class StepContext {

    GenerationGate generation;
    ToolInvoker toolInvoker;
    ToolRegistry tools;
    RunContext runContext;

    @Builder.Default
    int maxSteps = 10;

    @Builder.Default
    int maxReflections = 3;

    @Builder.Default
    int maxReplans = 2;

    /** Tool descriptions in registration order, one block per tool */
    public String describeTools() {
        if (tools == null || tools.size() == 0) {
            return "(no tools available)";
        }
        return tools.definitions().stream()
                .map(ToolDefinition::describe)
                .collect(Collectors.joining("\n"));
    }
}
