package com.deepansh.orchestrator.exception;

/**
 * Lookup of a named or identified record failed (episodes, presets, workflows).
 */
public class NotFoundException extends AgentException {

    public NotFoundException(String message) {
        super(message);
    }
}
