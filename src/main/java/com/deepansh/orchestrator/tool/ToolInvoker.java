package com.deepansh.orchestrator.tool;

import com.deepansh.orchestrator.exception.ToolExecutionException;
import com.deepansh.orchestrator.exception.ToolNotFoundException;
import com.deepansh.orchestrator.model.ToolCall;
import com.deepansh.orchestrator.observability.RunContext;
import com.deepansh.orchestrator.policy.PolicyChain;
import com.deepansh.orchestrator.resilience.BoundedExecution;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * The single, policy-gated path from a proposed action to an observation.
 *
 * 1. Run the action through the policy chain; a rejection becomes the observation
 *    and the tool is never touched.
 * 2. Resolve the tool; an unknown name becomes the observation.
 * 3. Execute with a timeout; errors, "ERROR:" results and timeouts become a failed
 *    outcome.
 *
 * Never throws. Both the ReAct ACT step and the Planning EXECUTE_STEP step go through here.
 */
@Slf4j
public class ToolInvoker {

    private final ToolRegistry toolRegistry;
    private final PolicyChain policyChain;
    private final BoundedExecution boundedExecution;
    private final Duration toolTimeout;

    public ToolInvoker(ToolRegistry toolRegistry,
                       PolicyChain policyChain,
                       BoundedExecution boundedExecution,
                       Duration toolTimeout) {
        this.toolRegistry = toolRegistry;
        this.policyChain = policyChain;
        this.boundedExecution = boundedExecution;
        this.toolTimeout = toolTimeout;
    }

    public ToolOutcome invoke(ToolCall proposed, RunContext runCtx) {
        PolicyChain.ActionVerdict verdict = policyChain.evaluate(proposed);
        if (!verdict.allowed()) {
            String msg = String.format("Action rejected by policy '%s': %s",
                    verdict.policyName(), verdict.reason());
            runCtx.recordToolCall(proposed.getToolName(), proposed.getArguments(), 0, ToolOutcome.Status.REJECTED);
            return ToolOutcome.rejected(proposed.getToolName(), msg);
        }

        ToolCall action = verdict.action();
        String toolName = action.getToolName();
        Map<String, Object> arguments = action.getArguments() != null ? action.getArguments() : Map.of();

        AgentTool tool;
        try {
            tool = toolRegistry.get(toolName);
        } catch (ToolNotFoundException e) {
            String msg = String.format("ERROR: Unknown tool '%s'. Available tools: %s",
                    toolName, toolRegistry.list());
            log.warn(msg);
            runCtx.recordToolCall(toolName, arguments, 0, ToolOutcome.Status.NOT_FOUND);
            return ToolOutcome.notFound(toolName, msg);
        } catch (RuntimeException e) {
            log.error("Tool [{}] could not be created", toolName, e);
            runCtx.recordToolCall(toolName, arguments, 0, ToolOutcome.Status.FAILED);
            return ToolOutcome.failed(toolName,
                    String.format("ERROR: Tool '%s' could not be created: %s", toolName, e.getMessage()));
        }

        log.info("Executing tool: [{}] with args: {}", toolName, arguments);
        long start = System.currentTimeMillis();
        ToolOutcome outcome = execute(tool, toolName, arguments);
        long latency = System.currentTimeMillis() - start;

        runCtx.recordToolCall(toolName, arguments, latency, outcome.status());
        log.debug("Tool [{}] finished in {}ms with status {}", toolName, latency, outcome.status());
        return outcome;
    }

    private ToolOutcome execute(AgentTool tool, String toolName, Map<String, Object> arguments) {
        try {
            String result = boundedExecution.call("tool:" + toolName, () -> tool.execute(arguments), toolTimeout);
            if (result == null) {
                return ToolOutcome.success(toolName, "");
            }
            if (result.startsWith("ERROR:")) {
                return ToolOutcome.failed(toolName, result);
            }
            return ToolOutcome.success(toolName, result);
        } catch (TimeoutException e) {
            return ToolOutcome.timedOut(toolName, String.format(
                    "ERROR: Tool '%s' timed out after %dms", toolName, toolTimeout.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolOutcome.failed(toolName, "ERROR: Tool '" + toolName + "' was interrupted");
        } catch (ToolExecutionException e) {
            log.warn("Tool [{}] failed: {}", toolName, e.getMessage());
            return ToolOutcome.failed(toolName, "ERROR: " + e.getMessage());
        } catch (Exception e) {
            log.error("Unexpected error in tool [{}]", toolName, e);
            return ToolOutcome.failed(toolName, "ERROR: Tool execution failed: " + e.getMessage());
        }
    }
}
