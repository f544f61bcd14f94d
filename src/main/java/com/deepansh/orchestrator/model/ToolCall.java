package com.deepansh.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * A proposed action: which tool to run and with what arguments.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {

    /** Correlates the action with the tool message that carries its observation */
    private String id;

    private String toolName;

    @Builder.Default
    private Map<String, Object> arguments = Map.of();
}
