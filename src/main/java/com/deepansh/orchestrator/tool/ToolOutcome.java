package com.deepansh.orchestrator.tool;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Result of running (or refusing to run) one action. Every status maps to an
 * observation text; only {@link Status#SUCCESS} counts as a successful step.
 */
public record ToolOutcome(String toolName, Status status, String output) {

    public enum Status {
        SUCCESS, FAILED, NOT_FOUND, REJECTED, TIMED_OUT
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public static ToolOutcome success(String toolName, String output) {
        return new ToolOutcome(toolName, Status.SUCCESS, output);
    }

    public static ToolOutcome failed(String toolName, String output) {
        return new ToolOutcome(toolName, Status.FAILED, output);
    }

    public static ToolOutcome notFound(String toolName, String output) {
        return new ToolOutcome(toolName, Status.NOT_FOUND, output);
    }

    public static ToolOutcome rejected(String toolName, String output) {
        return new ToolOutcome(toolName, Status.REJECTED, output);
    }

    public static ToolOutcome timedOut(String toolName, String output) {
        return new ToolOutcome(toolName, Status.TIMED_OUT, output);
    }
}
