package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.core.state.StrategyType;

public final class StateMachines {

    private StateMachines() {
    }

    public static StateMachine create(StrategyType strategy, ReActOutputParser parser) {
        return switch (strategy) {
            case REFLECTION -> new ReflectionMachine();
            case REACT -> new ReActMachine(parser);
            case PLANNING -> new PlanningMachine(parser);
        };
    }
}
