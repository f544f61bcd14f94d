package com.deepansh.orchestrator.core.state;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Immutable record of one executed plan step. Failed steps keep their error reason.
 */
@Value
@Builder
@Jacksonized
public class PlanStepResult {

    int index;
    String description;
    boolean success;
    String result;
    String error;

    public static PlanStepResult succeeded(int index, String description, String result) {
        return PlanStepResult.builder()
                .index(index)
                .description(description)
                .success(true)
                .result(result)
                .build();
    }

    public static PlanStepResult failed(int index, String description, String error) {
        return PlanStepResult.builder()
                .index(index)
                .description(description)
                .success(false)
                .error(error)
                .build();
    }
}
