package com.deepansh.orchestrator.generation;

import com.deepansh.orchestrator.exception.GenerationException;

/**
 * A generation failure worth retrying: 5xx, rate limiting, network errors.
 * Counted by the circuit breaker; plain {@link GenerationException}s are not retried.
 */
public class TransientGenerationException extends GenerationException {

    public TransientGenerationException(String message) {
        super(message);
    }

    public TransientGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
