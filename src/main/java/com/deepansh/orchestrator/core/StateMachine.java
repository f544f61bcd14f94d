package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.core.state.AgentState;
import com.deepansh.orchestrator.core.state.StrategyType;

/**
 * A reasoning strategy expressed as named steps over an {@link AgentState}.
 */
public interface StateMachine {

    StrategyType getStrategy();

    StepGraph getGraph();

    /**
     * A fresh state positioned at the graph's start step, with limits taken from the context.
     */
    AgentState newState(String input, StepContext ctx);

    /**
     * Executes steps until the state terminates. A state that is already terminated is
     * returned unchanged; a partially run one continues from its current step.
     *
     * @throws IllegalArgumentException if the state belongs to another strategy
     */
    AgentState run(AgentState state, StepContext ctx);
}
