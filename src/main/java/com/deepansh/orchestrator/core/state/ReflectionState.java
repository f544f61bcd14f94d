package com.deepansh.orchestrator.core.state;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class ReflectionState extends AgentState {

    private String initialResponse;
    private String currentReflection;
    private String refinedResponse;
    private int reflectionCount;
    private int maxReflections;

    public ReflectionState() {
    }

    public ReflectionState(String input, int maxReflections) {
        super(input, "GENERATE_INITIAL");
        this.maxReflections = maxReflections;
    }

    @Override
    public StrategyType getStrategy() {
        return StrategyType.REFLECTION;
    }

    public void incrementReflectionCount() {
        if (reflectionCount >= maxReflections) {
            throw new IllegalStateException(
                    "Reflection count would exceed max of " + maxReflections);
        }
        reflectionCount++;
    }

    /** Response the next critique targets: the latest refinement, else the initial draft */
    @JsonIgnore
    public String getLatestResponse() {
        return refinedResponse != null ? refinedResponse : initialResponse;
    }

    @Override
    public void checkInvariants() {
        if (reflectionCount < 0 || reflectionCount > maxReflections) {
            throw new IllegalStateException(String.format(
                    "reflectionCount %d outside [0, %d]", reflectionCount, maxReflections));
        }
        if (refinedResponse != null && reflectionCount == 0) {
            throw new IllegalStateException("refinedResponse present before any reflection cycle");
        }
    }
}
