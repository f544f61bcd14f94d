package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.core.state.AgentState;
import com.deepansh.orchestrator.core.state.ReflectionState;
import com.deepansh.orchestrator.core.state.StrategyType;
import com.deepansh.orchestrator.core.state.TerminationReason;
import com.deepansh.orchestrator.exception.GenerationException;
import com.deepansh.orchestrator.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Draft, critique, refine.
 *
 * GENERATE_INITIAL → REFLECT → REFINE → (REFLECT | TERMINATE). With zero allowed
 * reflections the initial draft is the answer. The loop stops early when a critique
 * contains {@value Markers#NO_FURTHER_IMPROVEMENT}.
 */
@Slf4j
public class ReflectionMachine extends AbstractStateMachine<ReflectionState> {

    static final String GENERATE_INITIAL = "GENERATE_INITIAL";
    static final String REFLECT = "REFLECT";
    static final String REFINE = "REFINE";

    private static final StepGraph GRAPH = StepGraph.startingAt(GENERATE_INITIAL)
            .edge(GENERATE_INITIAL, REFLECT, AgentState.TERMINATE)
            .edge(REFLECT, REFINE, AgentState.TERMINATE)
            .edge(REFINE, REFLECT, AgentState.TERMINATE)
            .build();

    public ReflectionMachine() {
        super(ReflectionState.class, GRAPH);
    }

    @Override
    public StrategyType getStrategy() {
        return StrategyType.REFLECTION;
    }

    @Override
    public AgentState newState(String input, StepContext ctx) {
        return new ReflectionState(input, ctx.getMaxReflections());
    }

    @Override
    protected void executeStep(String step, ReflectionState state, StepContext ctx) {
        try {
            switch (step) {
                case GENERATE_INITIAL -> generateInitial(state, ctx);
                case REFLECT -> reflect(state, ctx);
                case REFINE -> refine(state, ctx);
                default -> throw new IllegalStateException("Unhandled step " + step);
            }
        } catch (GenerationException e) {
            log.warn("Reflection step {} failed: {}", step, e.getMessage());
            String best = state.getLatestResponse();
            state.setOutput(best != null ? best : "Unable to generate a response: " + e.getMessage());
            state.terminate(TerminationReason.FAILED);
        }
    }

    private void generateInitial(ReflectionState state, StepContext ctx) {
        String draft = ctx.getGeneration().generate(
                Prompts.initialResponse(state.getInput()), state.getMessages(), ctx.getRunContext());
        state.setInitialResponse(draft);
        state.addMessage(Message.agent(draft, Map.of("step", GENERATE_INITIAL)));

        if (state.getMaxReflections() == 0) {
            state.setOutput(draft);
            state.terminate(TerminationReason.COMPLETED);
        } else {
            state.setCurrentStep(REFLECT);
        }
    }

    private void reflect(ReflectionState state, StepContext ctx) {
        String critique = ctx.getGeneration().generate(
                Prompts.reflect(state.getInput(), state.getLatestResponse()),
                state.getMessages(), ctx.getRunContext());
        state.setCurrentReflection(critique);
        state.incrementReflectionCount();
        state.addMessage(Message.agent(critique, Map.of(
                "step", REFLECT, "reflection", state.getReflectionCount())));
        state.setCurrentStep(REFINE);
    }

    private void refine(ReflectionState state, StepContext ctx) {
        String refined = ctx.getGeneration().generate(
                Prompts.refine(state.getInput(), state.getLatestResponse(), state.getCurrentReflection()),
                state.getMessages(), ctx.getRunContext());
        state.setRefinedResponse(refined);
        state.addMessage(Message.agent(refined, Map.of("step", REFINE)));

        boolean satisfied = Markers.contains(state.getCurrentReflection(), Markers.NO_FURTHER_IMPROVEMENT);
        if (!satisfied && state.getReflectionCount() < state.getMaxReflections()) {
            state.setCurrentStep(REFLECT);
            return;
        }
        state.setOutput(state.getLatestResponse());
        state.terminate(satisfied ? TerminationReason.NO_FURTHER_IMPROVEMENT : TerminationReason.COMPLETED);
    }
}
