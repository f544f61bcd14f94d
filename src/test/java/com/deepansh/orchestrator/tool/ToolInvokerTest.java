package com.deepansh.orchestrator.tool;

import com.deepansh.orchestrator.exception.ToolExecutionException;
import com.deepansh.orchestrator.model.ToolCall;
import com.deepansh.orchestrator.observability.RunContext;
import com.deepansh.orchestrator.policy.AgentPolicy;
import com.deepansh.orchestrator.policy.PolicyChain;
import com.deepansh.orchestrator.policy.PolicyDecision;
import com.deepansh.orchestrator.policy.SafetyPolicy;
import com.deepansh.orchestrator.resilience.BoundedExecution;
import com.deepansh.orchestrator.tool.impl.CalculatorTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolInvokerTest {

    private ToolRegistry registry;
    private RunContext runCtx;
    private BoundedExecution boundedExecution;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry();
        registry.register(new CalculatorTool());
        runCtx = new RunContext();
        boundedExecution = new BoundedExecution(new SimpleAsyncTaskExecutor("test-"));
    }

    private ToolInvoker invoker(PolicyChain chain, Duration timeout) {
        return new ToolInvoker(registry, chain, boundedExecution, timeout);
    }

    @Test
    void successfulCall_returnsOutputAndRecordsIt() {
        ToolOutcome outcome = invoker(new PolicyChain(), Duration.ofSeconds(5))
                .invoke(call("calculator", Map.of("expression", "2 + 2")), runCtx);

        assertThat(outcome.status()).isEqualTo(ToolOutcome.Status.SUCCESS);
        assertThat(outcome.output()).isEqualTo("4");
        assertThat(runCtx.toolsUsed()).containsExactly("calculator");
    }

    @Test
    void rejectedAction_neverReachesTheTool() {
        AgentTool shell = mockTool("shell");
        registry.register(shell);

        ToolOutcome outcome = invoker(PolicyChain.defaults(), Duration.ofSeconds(5))
                .invoke(call("shell", Map.of("command", "rm -rf /")), runCtx);

        assertThat(outcome.status()).isEqualTo(ToolOutcome.Status.REJECTED);
        assertThat(outcome.output()).startsWith("Action rejected by policy 'safety'").contains("rm -rf");
        verify(shell, never()).execute(anyMap());
        assertThat(runCtx.toolsUsed()).isEmpty();
    }

    @Test
    void rewrittenAction_isTheOneExecuted() {
        AgentPolicy rewriter = new AgentPolicy() {
            @Override
            public String getName() {
                return "rewriter";
            }

            @Override
            public PolicyDecision validateAction(ToolCall action) {
                return PolicyDecision.rewrite(action.toBuilder().arguments(Map.of("expression", "3 * 3")).build(),
                        "normalized");
            }
        };

        ToolOutcome outcome = invoker(new PolicyChain(List.of(rewriter)), Duration.ofSeconds(5))
                .invoke(call("calculator", Map.of("expression", "1 + 1")), runCtx);

        assertThat(outcome.output()).isEqualTo("9");
    }

    @Test
    void unknownTool_becomesNotFoundObservation() {
        ToolOutcome outcome = invoker(new PolicyChain(), Duration.ofSeconds(5))
                .invoke(call("teleport", Map.of()), runCtx);

        assertThat(outcome.status()).isEqualTo(ToolOutcome.Status.NOT_FOUND);
        assertThat(outcome.output()).isEqualTo("ERROR: Unknown tool 'teleport'. Available tools: [calculator]");
    }

    @Test
    void failingToolFactory_isFailureNotException() {
        registry.register("flaky_backend", () -> {
            throw new IllegalStateException("backing service down");
        });

        ToolOutcome outcome = invoker(new PolicyChain(), Duration.ofSeconds(5))
                .invoke(call("flaky_backend", Map.of()), runCtx);

        assertThat(outcome.status()).isEqualTo(ToolOutcome.Status.FAILED);
        assertThat(outcome.output())
                .isEqualTo("ERROR: Tool 'flaky_backend' could not be created: backing service down");
    }

    @Test
    void errorPrefixedResult_isFailure() {
        ToolOutcome outcome = invoker(new PolicyChain(), Duration.ofSeconds(5))
                .invoke(call("calculator", Map.of("expression", "1 / 0")), runCtx);

        assertThat(outcome.status()).isEqualTo(ToolOutcome.Status.FAILED);
        assertThat(outcome.isSuccess()).isFalse();
    }

    @Test
    void thrownToolExecutionException_isFailure() {
        AgentTool broken = mockTool("broken");
        when(broken.execute(anyMap())).thenThrow(new ToolExecutionException("broken", "disk full"));
        registry.register(broken);

        ToolOutcome outcome = invoker(new PolicyChain(), Duration.ofSeconds(5))
                .invoke(call("broken", Map.of()), runCtx);

        assertThat(outcome.status()).isEqualTo(ToolOutcome.Status.FAILED);
        assertThat(outcome.output()).startsWith("ERROR:").contains("disk full");
    }

    @Test
    void slowTool_timesOut() {
        AgentTool slow = mockTool("slow");
        when(slow.execute(anyMap())).thenAnswer(inv -> {
            Thread.sleep(5_000);
            return "too late";
        });
        registry.register(slow);

        long start = System.currentTimeMillis();
        ToolOutcome outcome = invoker(new PolicyChain(), Duration.ofMillis(200))
                .invoke(call("slow", Map.of()), runCtx);

        assertThat(outcome.status()).isEqualTo(ToolOutcome.Status.TIMED_OUT);
        assertThat(outcome.output()).isEqualTo("ERROR: Tool 'slow' timed out after 200ms");
        assertThat(System.currentTimeMillis() - start).isLessThan(3_000);
    }

    @Test
    void safetyPolicy_blocksPathTraversal() {
        ToolOutcome outcome = invoker(new PolicyChain(List.of(new SafetyPolicy())), Duration.ofSeconds(5))
                .invoke(call("calculator", Map.of("expression", "../../etc/passwd")), runCtx);

        assertThat(outcome.status()).isEqualTo(ToolOutcome.Status.REJECTED);
    }

    private static ToolCall call(String tool, Map<String, Object> args) {
        return ToolCall.builder().id("c1").toolName(tool).arguments(args).build();
    }

    private static AgentTool mockTool(String name) {
        AgentTool tool = mock(AgentTool.class);
        when(tool.getName()).thenReturn(name);
        when(tool.getDescription()).thenReturn(name);
        when(tool.getInputSchema()).thenReturn(Map.of());
        return tool;
    }
}
