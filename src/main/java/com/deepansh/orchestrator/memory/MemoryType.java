package com.deepansh.orchestrator.memory;

import com.deepansh.orchestrator.exception.NotFoundException;

import java.util.Arrays;

public enum MemoryType {
    SIMPLE,
    CONVERSATION,
    EPISODIC;

    public static MemoryType fromName(String name) {
        return Arrays.stream(values())
                .filter(t -> t.name().equalsIgnoreCase(name == null ? "" : name.trim()))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("Unknown memory type '" + name
                        + "'. Available: simple, conversation, episodic"));
    }
}
