package com.deepansh.orchestrator.core.state;

/**
 * Why a state machine stopped. Only {@link #FAILED} denotes a degraded run;
 * {@link #STEP_LIMIT} is a normal truncation.
 */
public enum TerminationReason {
    COMPLETED,
    FINAL_ANSWER,
    NO_FURTHER_IMPROVEMENT,
    STEP_LIMIT,
    REPLAN_EXHAUSTED,
    FAILED
}
