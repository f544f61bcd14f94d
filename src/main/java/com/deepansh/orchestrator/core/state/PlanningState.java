package com.deepansh.orchestrator.core.state;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSetter;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Planning progress.
 *
 * Invariants:
 * - currentStepIndex stays within [0, plan.size()]
 * - every completed index is a valid plan index and, once recorded, never changes
 * - the plan is fixed once execution starts; only a replan may replace the steps
 *   after the current index
 */
@Getter
@Setter
public class PlanningState extends AgentState {

    private String goal;
    private int currentStepIndex;
    private int replanCount;
    private int maxReplans;
    private int stepsExecuted;
    private int maxSteps;

    /** Verdict of the most recent EVALUATE step */
    private String evaluation;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private final List<String> plan = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private final Map<Integer, PlanStepResult> completedSteps = new LinkedHashMap<>();

    public PlanningState() {
    }

    public PlanningState(String input, int maxSteps, int maxReplans) {
        super(input, "UNDERSTAND_GOAL");
        this.maxSteps = maxSteps;
        this.maxReplans = maxReplans;
    }

    @Override
    public StrategyType getStrategy() {
        return StrategyType.PLANNING;
    }

    public List<String> getPlan() {
        return Collections.unmodifiableList(plan);
    }

    public Map<Integer, PlanStepResult> getCompletedSteps() {
        return Collections.unmodifiableMap(completedSteps);
    }

    @JsonIgnore
    public Set<Integer> getCompletedStepIndices() {
        return Collections.unmodifiableSet(completedSteps.keySet());
    }

    public void startPlan(List<String> steps) {
        if (stepsExecuted > 0) {
            throw new IllegalStateException("Plan is fixed once execution has started; replan instead");
        }
        plan.clear();
        plan.addAll(steps);
        currentStepIndex = 0;
    }

    @JsonIgnore
    public String getCurrentStepDescription() {
        return currentStepIndex < plan.size() ? plan.get(currentStepIndex) : null;
    }

    @JsonIgnore
    public boolean hasNextStep() {
        return currentStepIndex + 1 < plan.size();
    }

    @JsonIgnore
    public PlanStepResult getLastResult() {
        return completedSteps.get(currentStepIndex);
    }

    public void recordStepResult(PlanStepResult result) {
        int index = result.getIndex();
        if (index < 0 || index >= plan.size()) {
            throw new IllegalStateException("Step index " + index + " outside plan of size " + plan.size());
        }
        if (completedSteps.containsKey(index)) {
            throw new IllegalStateException("Step " + index + " already completed");
        }
        completedSteps.put(index, result);
        stepsExecuted++;
    }

    public void advance() {
        if (currentStepIndex >= plan.size()) {
            throw new IllegalStateException("Cannot advance past the end of the plan");
        }
        currentStepIndex++;
    }

    /**
     * Keeps every step up to and including the current one, replaces the rest and
     * moves to the first replacement step.
     */
    public void replaceRemainingSteps(List<String> newSteps) {
        List<String> kept = new ArrayList<>(plan.subList(0, Math.min(currentStepIndex + 1, plan.size())));
        plan.clear();
        plan.addAll(kept);
        plan.addAll(newSteps);
        replanCount++;
        currentStepIndex = Math.min(kept.size(), plan.size());
    }

    @Override
    public void checkInvariants() {
        if (currentStepIndex < 0 || currentStepIndex > plan.size()) {
            throw new IllegalStateException(String.format(
                    "currentStepIndex %d outside [0, %d]", currentStepIndex, plan.size()));
        }
        for (Integer index : completedSteps.keySet()) {
            if (index < 0 || index >= plan.size()) {
                throw new IllegalStateException("completed step " + index + " outside plan");
            }
        }
        if (replanCount > maxReplans) {
            throw new IllegalStateException("replanCount exceeds max of " + maxReplans);
        }
    }

    @JsonSetter("plan")
    private void restorePlan(List<String> restored) {
        plan.clear();
        if (restored != null) {
            plan.addAll(restored);
        }
    }

    @JsonSetter("completedSteps")
    private void restoreCompletedSteps(Map<Integer, PlanStepResult> restored) {
        completedSteps.clear();
        if (restored != null) {
            completedSteps.putAll(restored);
        }
    }
}
