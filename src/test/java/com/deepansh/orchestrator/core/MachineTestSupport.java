package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.generation.GenerationClient;
import com.deepansh.orchestrator.generation.SamplingParameters;
import com.deepansh.orchestrator.observability.RunContext;
import com.deepansh.orchestrator.policy.PolicyChain;
import com.deepansh.orchestrator.resilience.BoundedExecution;
import com.deepansh.orchestrator.tool.ToolInvoker;
import com.deepansh.orchestrator.tool.ToolRegistry;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.time.Duration;

final class MachineTestSupport {

    private MachineTestSupport() {
    }

    static StepContext.StepContextBuilder context(GenerationClient client, ToolRegistry tools, PolicyChain policies) {
        BoundedExecution bounded = new BoundedExecution(new SimpleAsyncTaskExecutor("machine-test-"));
        return StepContext.builder()
                .generation(new GenerationGate(client, bounded, Duration.ofSeconds(5), SamplingParameters.defaults()))
                .toolInvoker(new ToolInvoker(tools, policies, bounded, Duration.ofSeconds(5)))
                .tools(tools)
                .runContext(new RunContext());
    }
}
