package com.deepansh.orchestrator.exception;

/**
 * Root of the orchestrator's exception hierarchy.
 *
 * Configuration-time subclasses surface directly to callers of the factory and registry.
 * Runtime subclasses are caught at the step boundary and turned into state data.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
