package com.deepansh.orchestrator.memory;

import com.deepansh.orchestrator.model.Interaction;
import com.deepansh.orchestrator.model.Message;

import java.util.List;
import java.util.Optional;

/**
 * Cross-run storage attached to an agent. Outlives individual runs and may be
 * shared between agents, so implementations synchronize their own mutation.
 */
public interface Memory {

    void store(String key, Object value);

    Optional<Object> retrieve(String key);

    void clear();

    /**
     * Messages to seed a fresh run with, read once at the start of the run.
     */
    List<Message> contextFor(String input);

    /**
     * Called once after a run finishes.
     */
    void record(Interaction interaction);

    MemoryType type();
}
