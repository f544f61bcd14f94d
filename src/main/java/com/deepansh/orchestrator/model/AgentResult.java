package com.deepansh.orchestrator.model;

import com.deepansh.orchestrator.core.state.AgentState;
import com.deepansh.orchestrator.core.state.StrategyType;
import com.deepansh.orchestrator.core.state.TerminationReason;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AgentResult {

    String output;
    StrategyType strategy;
    TerminationReason terminationReason;
    int stepsUsed;

    @Builder.Default
    List<String> toolsUsed = List.of();

    /** The terminal state of the run; serialize it with AgentStateCodec to resume later */
    AgentState state;

    public boolean isStepLimitReached() {
        return terminationReason == TerminationReason.STEP_LIMIT;
    }
}
