package com.deepansh.orchestrator.observability;

import com.deepansh.orchestrator.tool.ToolOutcome;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable per-run record of what happened at the suspension points:
 * tool calls with latency and status, generation calls and failures.
 *
 * Kept separate from AgentState (which holds reasoning state) so observability
 * concerns don't bleed into the state machines. Summarized in the run log line.
 */
public class RunContext {

    private final long startTimeMs = System.currentTimeMillis();
    private final List<ToolCallRecord> toolCallRecords = new ArrayList<>();

    @Getter
    private int generationCalls;

    @Getter
    private int generationFailures;

    public void recordToolCall(String toolName, Object args, long latencyMs, ToolOutcome.Status status) {
        toolCallRecords.add(new ToolCallRecord(toolName, args, latencyMs, status));
    }

    public void recordGeneration(boolean success) {
        generationCalls++;
        if (!success) {
            generationFailures++;
        }
    }

    public List<ToolCallRecord> getToolCallRecords() {
        return Collections.unmodifiableList(toolCallRecords);
    }

    /** Names of tools that actually ran, in call order; rejected and unknown tools excluded */
    public List<String> toolsUsed() {
        return toolCallRecords.stream()
                .filter(r -> r.status() != ToolOutcome.Status.REJECTED && r.status() != ToolOutcome.Status.NOT_FOUND)
                .map(ToolCallRecord::toolName)
                .toList();
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    public record ToolCallRecord(
            String toolName,
            Object args,
            long latencyMs,
            ToolOutcome.Status status
    ) {}
}
