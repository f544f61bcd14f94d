package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.core.state.AgentState;
import com.deepansh.orchestrator.core.state.ReActState;
import com.deepansh.orchestrator.core.state.StrategyType;
import com.deepansh.orchestrator.core.state.TerminationReason;
import com.deepansh.orchestrator.exception.GenerationException;
import com.deepansh.orchestrator.model.Message;
import com.deepansh.orchestrator.model.ToolCall;
import com.deepansh.orchestrator.tool.ToolOutcome;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;

/**
 * Reason → Act → Observe.
 *
 * THINK either answers (terminating with FINAL_ANSWER) or proposes an action;
 * ACT runs it through the policy-gated {@link com.deepansh.orchestrator.tool.ToolInvoker};
 * OBSERVE appends the outcome as a tool message. After maxSteps observations the
 * run stops with STEP_LIMIT and the last observation.
 */
@Slf4j
public class ReActMachine extends AbstractStateMachine<ReActState> {

    static final String THINK = "THINK";
    static final String ACT = "ACT";
    static final String OBSERVE = "OBSERVE";

    private static final StepGraph GRAPH = StepGraph.startingAt(THINK)
            .edge(THINK, ACT, AgentState.TERMINATE)
            .edge(ACT, OBSERVE)
            .edge(OBSERVE, THINK, AgentState.TERMINATE)
            .build();

    private final ReActOutputParser parser;

    public ReActMachine() {
        this(new ReActOutputParser(new ObjectMapper()));
    }

    public ReActMachine(ReActOutputParser parser) {
        super(ReActState.class, GRAPH);
        this.parser = parser;
    }

    @Override
    public StrategyType getStrategy() {
        return StrategyType.REACT;
    }

    @Override
    public AgentState newState(String input, StepContext ctx) {
        return new ReActState(input, ctx.getMaxSteps());
    }

    @Override
    protected void executeStep(String step, ReActState state, StepContext ctx) {
        switch (step) {
            case THINK -> think(state, ctx);
            case ACT -> act(state, ctx);
            case OBSERVE -> observe(state);
            default -> throw new IllegalStateException("Unhandled step " + step);
        }
    }

    private void think(ReActState state, StepContext ctx) {
        String text;
        try {
            text = ctx.getGeneration().generate(
                    Prompts.think(state.getInput(), ctx.describeTools()),
                    state.getMessages(), ctx.getRunContext());
        } catch (GenerationException e) {
            log.warn("THINK failed at step {}: {}", state.getStepCount(), e.getMessage());
            state.setOutput(state.getObservation() != null
                    ? state.getObservation()
                    : "Unable to complete the request: " + e.getMessage());
            state.terminate(TerminationReason.FAILED);
            return;
        }

        ReActOutputParser.Parsed parsed = parser.parse(text);
        state.addMessage(Message.agent(text, Map.of("step", THINK)));

        if (parsed.isFinal()) {
            state.recordThought(parsed.thought(), null);
            state.setFinalAnswer(parsed.finalAnswer());
            state.setOutput(parsed.finalAnswer());
            state.terminate(TerminationReason.FINAL_ANSWER);
            return;
        }

        if (state.getStepCount() >= state.getMaxSteps()) {
            state.recordThought(parsed.thought(), null);
            state.setOutput(stepLimitOutput(state));
            state.terminate(TerminationReason.STEP_LIMIT);
            return;
        }

        log.info("Action proposed: [{}] ({}/{})",
                parsed.action().getToolName(), state.getStepCount() + 1, state.getMaxSteps());
        state.recordThought(parsed.thought(), parsed.action());
        state.setCurrentStep(ACT);
    }

    private void act(ReActState state, StepContext ctx) {
        ToolOutcome outcome = ctx.getToolInvoker().invoke(state.getAction(), ctx.getRunContext());
        state.recordActOutcome(outcome);
        state.setCurrentStep(OBSERVE);
    }

    private void observe(ReActState state) {
        ToolOutcome outcome = state.getPendingOutcome();
        ToolCall action = state.getAction();
        String observation = outcome.output() != null ? outcome.output() : "";

        Map<String, Object> meta = new HashMap<>();
        meta.put("step", OBSERVE);
        meta.put("status", outcome.status().name());
        if (action.getId() != null) {
            meta.put("callId", action.getId());
        }
        state.addMessage(Message.tool(outcome.toolName(), observation, meta));
        state.recordObservation(observation);

        if (state.getStepCount() < state.getMaxSteps()) {
            state.setCurrentStep(THINK);
            return;
        }
        log.warn("ReAct step limit of {} reached", state.getMaxSteps());
        state.setOutput(stepLimitOutput(state));
        state.terminate(TerminationReason.STEP_LIMIT);
    }

    private static String stepLimitOutput(ReActState state) {
        String last = state.getObservation() != null ? state.getObservation() : "";
        return "[Step limit of " + state.getMaxSteps() + " reached] " + last;
    }
}
