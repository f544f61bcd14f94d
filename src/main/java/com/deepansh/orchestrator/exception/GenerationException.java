package com.deepansh.orchestrator.exception;

/**
 * The generation capability failed: network, rate limit, timeout or model error.
 * Always recoverable by the calling state-machine step.
 */
public class GenerationException extends AgentException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
