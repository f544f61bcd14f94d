package com.deepansh.orchestrator.memory;

public final class MemoryFactory {

    private MemoryFactory() {
    }

    public static Memory create(MemoryType type, MemoryProperties properties) {
        return switch (type) {
            case SIMPLE -> new SimpleMemory();
            case CONVERSATION -> new ConversationMemory(properties.getMaxHistory(), properties.getContextTurns());
            case EPISODIC -> new EpisodicMemory(new TokenOverlapScorer(), properties.getRecallLimit());
        };
    }

    public static Memory create(MemoryProperties properties) {
        return create(properties.getType(), properties);
    }
}
