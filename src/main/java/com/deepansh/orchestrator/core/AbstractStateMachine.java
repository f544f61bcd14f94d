package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.core.state.AgentState;
import com.deepansh.orchestrator.core.state.TerminationReason;
import lombok.extern.slf4j.Slf4j;

/**
 * Step loop shared by every strategy: dispatch the current step, check the
 * transition against the graph, repeat until TERMINATE.
 */
@Slf4j
public abstract class AbstractStateMachine<S extends AgentState> implements StateMachine {

    private final Class<S> stateType;
    private final StepGraph graph;

    protected AbstractStateMachine(Class<S> stateType, StepGraph graph) {
        this.stateType = stateType;
        this.graph = graph;
    }

    @Override
    public StepGraph getGraph() {
        return graph;
    }

    @Override
    public AgentState run(AgentState state, StepContext ctx) {
        if (!stateType.isInstance(state)) {
            throw new IllegalArgumentException(String.format(
                    "%s machine cannot run a %s state", getStrategy().strategyName(),
                    state.getStrategy().strategyName()));
        }
        S typed = stateType.cast(state);
        typed.checkInvariants();

        while (!typed.isTerminated()) {
            String step = typed.getCurrentStep();
            if (!graph.hasNode(step)) {
                throw new IllegalStateException("Unknown step '" + step + "' for " + getStrategy().strategyName());
            }

            typed.recordStep(step);
            executeStep(step, typed, ctx);

            String next = typed.getCurrentStep();
            if (!graph.allows(step, next)) {
                throw new IllegalStateException("Illegal transition " + step + " -> " + next);
            }
            log.debug("[{}] {} -> {}", getStrategy().strategyName(), step, next);
            typed.checkInvariants();
        }

        if (typed.getTerminationReason() == null) {
            typed.terminate(TerminationReason.COMPLETED);
        }
        return typed;
    }

    /**
     * Runs one step and moves the state to its successor, either by setting the
     * current step or by terminating it.
     */
    protected abstract void executeStep(String step, S state, StepContext ctx);
}
