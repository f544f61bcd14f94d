package com.deepansh.orchestrator.memory;

import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * Bound under agent.memory.* and copied into each agent's configuration.
 */
@Data
public class MemoryProperties {

    private MemoryType type = MemoryType.CONVERSATION;

    /** Conversation turns kept before the oldest is evicted */
    @Min(1)
    private int maxHistory = 100;

    /** Recent turns replayed into a new run */
    @Min(0)
    private int contextTurns = 5;

    /** Episodes recalled into a new run */
    @Min(0)
    private int recallLimit = 3;
}
