package com.deepansh.orchestrator.core.state;

import com.deepansh.orchestrator.exception.UnknownStrategyException;

import java.util.Locale;

/**
 * Tag for the closed set of reasoning strategies. Factories dispatch on this tag.
 */
public enum StrategyType {

    REFLECTION("reflection"),
    REACT("react"),
    PLANNING("planning");

    private final String strategyName;

    StrategyType(String strategyName) {
        this.strategyName = strategyName;
    }

    public String strategyName() {
        return strategyName;
    }

    public static StrategyType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new UnknownStrategyException(String.valueOf(name));
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (StrategyType type : values()) {
            if (type.strategyName.equals(normalized)) {
                return type;
            }
        }
        throw new UnknownStrategyException(name);
    }
}
