package com.deepansh.orchestrator.agent;

import com.deepansh.orchestrator.core.GenerationGate;
import com.deepansh.orchestrator.core.StateMachine;
import com.deepansh.orchestrator.core.StepContext;
import com.deepansh.orchestrator.core.StepGraph;
import com.deepansh.orchestrator.core.state.AgentState;
import com.deepansh.orchestrator.core.state.AgentStateCodec;
import com.deepansh.orchestrator.core.state.StrategyType;
import com.deepansh.orchestrator.core.state.TerminationReason;
import com.deepansh.orchestrator.generation.GenerationClient;
import com.deepansh.orchestrator.generation.SamplingParameters;
import com.deepansh.orchestrator.memory.Memory;
import com.deepansh.orchestrator.model.AgentResult;
import com.deepansh.orchestrator.model.Interaction;
import com.deepansh.orchestrator.model.Message;
import com.deepansh.orchestrator.observability.RunContext;
import com.deepansh.orchestrator.policy.AgentPolicy;
import com.deepansh.orchestrator.policy.PolicyChain;
import com.deepansh.orchestrator.resilience.BoundedExecution;
import com.deepansh.orchestrator.tool.AgentTool;
import com.deepansh.orchestrator.tool.ToolInvoker;
import com.deepansh.orchestrator.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A configured strategy plus the tools, policies and memory it runs with.
 *
 * Per-run flow:
 * 1. Fresh state for the strategy
 * 2. Memory context, then the user input, appended as messages
 * 3. State machine runs to TERMINATE
 * 4. Final output filtered through the policy chain
 * 5. Interaction recorded in memory
 *
 * Runs of one agent may overlap: each has its own state and step context, while
 * tools, policies and memory are thread-safe.
 */
@Slf4j
public class Agent {

    private final StateMachine machine;
    private final GenerationClient generationClient;
    private final AgentConfig config;
    private final ToolRegistry tools;
    private final PolicyChain policyChain;
    private final BoundedExecution boundedExecution;
    private final AgentStateCodec stateCodec;

    private volatile Memory memory;
    private volatile AgentState lastState;

    Agent(StateMachine machine,
          GenerationClient generationClient,
          AgentConfig config,
          ToolRegistry tools,
          PolicyChain policyChain,
          Memory memory,
          BoundedExecution boundedExecution,
          AgentStateCodec stateCodec) {
        this.machine = machine;
        this.generationClient = generationClient;
        this.config = config;
        this.tools = tools;
        this.policyChain = policyChain;
        this.memory = memory;
        this.boundedExecution = boundedExecution;
        this.stateCodec = stateCodec;
    }

    public static AgentBuilder builder() {
        return new AgentBuilder();
    }

    /**
     * Runs the input to completion and returns the final, policy-filtered text.
     * Failures inside the run come back as text; this never throws.
     */
    public String process(String input) {
        return run(input).getOutput();
    }

    public AgentResult run(String input) {
        StepContext ctx = newStepContext();
        AgentState state = machine.newState(input, ctx);

        try {
            memory.contextFor(input).forEach(state::addMessage);
        } catch (RuntimeException e) {
            log.warn("Memory context unavailable, continuing without it: {}", e.getMessage());
        }
        state.addMessage(Message.user(input));

        return execute(state, ctx, true);
    }

    /**
     * Continues a run from a previously captured state. A terminated state is
     * returned as-is and not recorded again.
     */
    public AgentResult resume(AgentState state) {
        Objects.requireNonNull(state, "state");
        if (state.getStrategy() != machine.getStrategy()) {
            throw new IllegalArgumentException(String.format(
                    "Cannot resume a %s state on a %s agent",
                    state.getStrategy().strategyName(), machine.getStrategy().strategyName()));
        }
        boolean alreadyTerminated = state.isTerminated();
        return execute(state, newStepContext(), !alreadyTerminated);
    }

    public AgentResult resume(Map<String, Object> record) {
        return resume(stateCodec.fromRecord(record));
    }

    private AgentResult execute(AgentState state, StepContext ctx, boolean recordInteraction) {
        RunContext runCtx = ctx.getRunContext();
        log.info("Agent run started [strategy={}, step={}, input='{}']",
                machine.getStrategy().strategyName(), state.getCurrentStep(), state.getInput());

        String output;
        try {
            machine.run(state, ctx);
            output = policyChain.filterResponse(state.getOutput() != null ? state.getOutput() : "");
        } catch (RuntimeException e) {
            log.error("Agent run failed [strategy={}]", machine.getStrategy().strategyName(), e);
            String error = "An error occurred: " + e.getMessage();
            if (!state.isTerminated()) {
                state.setOutput(error);
                state.terminate(TerminationReason.FAILED);
            }
            output = filterSafely(error);
        }

        List<String> toolsUsed = runCtx.toolsUsed();
        if (recordInteraction) {
            try {
                memory.record(Interaction.builder()
                        .input(state.getInput())
                        .output(output)
                        .strategy(machine.getStrategy().strategyName())
                        .outcome(state.getTerminationReason() != null ? state.getTerminationReason().name() : null)
                        .toolsUsed(toolsUsed)
                        .build());
            } catch (RuntimeException e) {
                log.warn("Failed to record interaction in memory: {}", e.getMessage());
            }
        }
        lastState = state;

        log.info("Agent run complete [strategy={}, reason={}, steps={}, tools={}, generations={}, latency={}ms]",
                machine.getStrategy().strategyName(), state.getTerminationReason(),
                state.getStepHistory().size(), toolsUsed, runCtx.getGenerationCalls(), runCtx.elapsedMs());

        return AgentResult.builder()
                .output(output)
                .strategy(machine.getStrategy())
                .terminationReason(state.getTerminationReason())
                .stepsUsed(state.getStepHistory().size())
                .toolsUsed(toolsUsed)
                .state(state)
                .build();
    }

    private String filterSafely(String text) {
        try {
            return policyChain.filterResponse(text);
        } catch (RuntimeException e) {
            log.warn("Response policies failed on the error text: {}", e.getMessage());
            return text;
        }
    }

    private StepContext newStepContext() {
        SamplingParameters sampling = SamplingParameters.builder()
                .temperature(config.getTemperature())
                .maxTokens(config.getMaxTokens())
                .build();
        return StepContext.builder()
                .generation(new GenerationGate(generationClient, boundedExecution,
                        config.getGenerationTimeout(), sampling))
                .toolInvoker(new ToolInvoker(tools, policyChain, boundedExecution, config.getToolTimeout()))
                .tools(tools)
                .runContext(new RunContext())
                .maxSteps(config.getMaxSteps())
                .maxReflections(config.getMaxReflections())
                .maxReplans(config.getMaxReplans())
                .build();
    }

    /**
     * @throws com.deepansh.orchestrator.exception.DuplicateToolException if the name is taken
     */
    public void addTool(AgentTool tool) {
        tools.register(tool);
        log.info("Tool [{}] added to {} agent", tool.getName(), machine.getStrategy().strategyName());
    }

    public void addPolicy(AgentPolicy policy) {
        policyChain.add(policy);
    }

    public void setMemory(Memory memory) {
        this.memory = Objects.requireNonNull(memory, "memory");
    }

    public Memory getMemory() {
        return memory;
    }

    /** State of the most recent run, or null before the first run */
    public AgentState getState() {
        return lastState;
    }

    public Map<String, Object> getStateRecord() {
        AgentState state = lastState;
        return state != null ? stateCodec.toRecord(state) : null;
    }

    public StepGraph getGraph() {
        return machine.getGraph();
    }

    public StrategyType getStrategy() {
        return machine.getStrategy();
    }

    public AgentConfig getConfig() {
        return config.toBuilder().build();
    }

    public ToolRegistry getTools() {
        return tools;
    }

    public PolicyChain getPolicyChain() {
        return policyChain;
    }
}
