package com.deepansh.orchestrator.core.state;

import com.deepansh.orchestrator.model.Message;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Serializable snapshot of one in-progress run.
 *
 * Holds what every strategy shares: the input, the append-only message history,
 * the name of the next step to execute and the trail of steps already executed.
 * Strategy-specific fields live in the three subclasses. The state is mutated only
 * by its owning state machine and is never shared between concurrent runs.
 */
@Getter
@Setter
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "strategy")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ReflectionState.class, name = "reflection"),
        @JsonSubTypes.Type(value = ReActState.class, name = "react"),
        @JsonSubTypes.Type(value = PlanningState.class, name = "planning")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class AgentState {

    public static final String TERMINATE = "TERMINATE";

    private String input;

    /** Name of the next step to run; {@link #TERMINATE} once the machine has stopped */
    private String currentStep;

    private TerminationReason terminationReason;

    /** Terminal output before response policies are applied */
    private String output;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private final List<Message> messages = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private final List<String> stepHistory = new ArrayList<>();

    protected AgentState() {
    }

    protected AgentState(String input, String initialStep) {
        this.input = input;
        this.currentStep = initialStep;
    }

    @JsonIgnore
    public abstract StrategyType getStrategy();

    /**
     * Throws {@link IllegalStateException} when a strategy-specific bound is violated.
     */
    public abstract void checkInvariants();

    public List<Message> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public void addMessage(Message message) {
        messages.add(message);
    }

    public List<String> getStepHistory() {
        return Collections.unmodifiableList(stepHistory);
    }

    public void recordStep(String step) {
        stepHistory.add(step);
    }

    public long countSteps(String step) {
        return stepHistory.stream().filter(step::equals).count();
    }

    @JsonIgnore
    public boolean isTerminated() {
        return TERMINATE.equals(currentStep);
    }

    public void terminate(TerminationReason reason) {
        this.currentStep = TERMINATE;
        this.terminationReason = reason;
    }

    /**
     * The conversation rendered as plain text, one "role: content" line per message.
     */
    @JsonIgnore
    public String getContext() {
        return messages.stream()
                .map(m -> m.getRole() + ": " + m.getContent())
                .collect(Collectors.joining("\n"));
    }

    @JsonSetter("messages")
    private void restoreMessages(List<Message> restored) {
        messages.clear();
        if (restored != null) {
            messages.addAll(restored);
        }
    }

    @JsonSetter("stepHistory")
    private void restoreStepHistory(List<String> restored) {
        stepHistory.clear();
        if (restored != null) {
            stepHistory.addAll(restored);
        }
    }
}
