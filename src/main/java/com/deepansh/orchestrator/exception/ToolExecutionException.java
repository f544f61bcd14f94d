package com.deepansh.orchestrator.exception;

import lombok.Getter;

/**
 * A tool ran but failed. Tools may throw this directly; the invoker also wraps
 * any other runtime failure a tool raises.
 */
@Getter
public class ToolExecutionException extends AgentException {

    private final String toolName;

    public ToolExecutionException(String toolName, String message) {
        super(message);
        this.toolName = toolName;
    }

    public ToolExecutionException(String toolName, String message, Throwable cause) {
        super(message, cause);
        this.toolName = toolName;
    }
}
