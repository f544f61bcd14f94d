package com.deepansh.orchestrator.agent;

import com.deepansh.orchestrator.memory.MemoryProperties;
import com.deepansh.orchestrator.memory.MemoryType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.List;

/**
 * Per-agent settings. Scalar limits feed the state machines; tool and policy
 * names are resolved by {@link AgentFactory} against the shared catalogs.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentConfig {

    @Builder.Default
    private int maxSteps = 10;

    @Builder.Default
    private int maxReflections = 3;

    @Builder.Default
    private int maxReplans = 2;

    @Builder.Default
    private double temperature = 0.7;

    @Builder.Default
    private int maxTokens = 1024;

    @Builder.Default
    private Duration toolTimeout = Duration.ofSeconds(30);

    @Builder.Default
    private Duration generationTimeout = Duration.ofSeconds(60);

    @Builder.Default
    private MemoryType memoryType = MemoryType.CONVERSATION;

    @Builder.Default
    private int maxHistory = 100;

    @Builder.Default
    private int contextTurns = 5;

    @Builder.Default
    private int recallLimit = 3;

    /** Catalog tool names; null means every catalog tool, empty means none */
    private List<String> tools;

    @Builder.Default
    private List<String> policies = List.of("safety", "content_filter");

    /**
     * @throws IllegalArgumentException on a limit or timeout out of range
     */
    public void validate() {
        require(maxSteps >= 1, "maxSteps must be at least 1, got " + maxSteps);
        require(maxReflections >= 0, "maxReflections must not be negative, got " + maxReflections);
        require(maxReplans >= 0, "maxReplans must not be negative, got " + maxReplans);
        require(maxTokens >= 1, "maxTokens must be at least 1, got " + maxTokens);
        require(maxHistory >= 1, "maxHistory must be at least 1, got " + maxHistory);
        require(toolTimeout != null && !toolTimeout.isNegative() && !toolTimeout.isZero(),
                "toolTimeout must be positive");
        require(generationTimeout != null && !generationTimeout.isNegative() && !generationTimeout.isZero(),
                "generationTimeout must be positive");
        require(memoryType != null, "memoryType is required");
    }

    public MemoryProperties toMemoryProperties() {
        MemoryProperties props = new MemoryProperties();
        props.setType(memoryType);
        props.setMaxHistory(maxHistory);
        props.setContextTurns(contextTurns);
        props.setRecallLimit(recallLimit);
        return props;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
