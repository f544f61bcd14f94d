package com.deepansh.orchestrator.core.state;

import com.deepansh.orchestrator.model.ToolCall;
import com.deepansh.orchestrator.tool.ToolOutcome;
import lombok.Getter;
import lombok.Setter;

/**
 * ReAct progress. The THINK / ACT / OBSERVE transitions go through
 * {@link #recordThought}, {@link #recordActOutcome} and {@link #recordObservation}
 * so an observation can only ever exist for the action of the same cycle.
 */
@Getter
@Setter
public class ReActState extends AgentState {

    private String thought;
    private ToolCall action;

    /** Outcome produced by ACT, consumed by OBSERVE */
    private ToolOutcome pendingOutcome;

    private String observation;
    private String finalAnswer;
    private int stepCount;
    private int maxSteps;

    public ReActState() {
    }

    public ReActState(String input, int maxSteps) {
        super(input, "THINK");
        this.maxSteps = maxSteps;
    }

    @Override
    public StrategyType getStrategy() {
        return StrategyType.REACT;
    }

    public void recordThought(String thought, ToolCall action) {
        this.thought = thought;
        this.action = action;
        this.pendingOutcome = null;
        this.observation = null;
    }

    public void recordActOutcome(ToolOutcome outcome) {
        if (action == null) {
            throw new IllegalStateException("ACT without an action from THINK");
        }
        this.pendingOutcome = outcome;
    }

    public void recordObservation(String observation) {
        if (pendingOutcome == null) {
            throw new IllegalStateException("OBSERVE without a preceding ACT");
        }
        if (stepCount >= maxSteps) {
            throw new IllegalStateException("Step count would exceed max of " + maxSteps);
        }
        this.observation = observation;
        this.pendingOutcome = null;
        this.stepCount++;
    }

    @Override
    public void checkInvariants() {
        if (stepCount < 0 || stepCount > maxSteps) {
            throw new IllegalStateException(String.format(
                    "stepCount %d outside [0, %d]", stepCount, maxSteps));
        }
        if (pendingOutcome != null && action == null) {
            throw new IllegalStateException("pending outcome without an action");
        }
    }
}
