package com.deepansh.orchestrator.tool;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Immutable snapshot of a tool's schema as presented to the model.
 * Decouples prompt rendering from the AgentTool implementation.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private Map<String, Object> inputSchema;

    public static ToolDefinition from(AgentTool tool) {
        return ToolDefinition.builder()
                .name(tool.getName())
                .description(tool.getDescription())
                .inputSchema(tool.getInputSchema())
                .build();
    }

    /**
     * One-paragraph rendering for the tool listing in prompts:
     * "name: description" followed by the parameter names and types.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder()
                .append("- ").append(name).append(": ")
                .append(description == null ? "" : description.strip().replaceAll("\\s+", " "));

        Object properties = inputSchema == null ? null : inputSchema.get("properties");
        if (properties instanceof Map<?, ?> props && !props.isEmpty()) {
            sb.append("\n  parameters: ");
            props.forEach((param, spec) -> {
                Object type = spec instanceof Map<?, ?> m ? m.get("type") : spec;
                sb.append(param).append(" (").append(type).append(") ");
            });
        }
        return sb.toString().stripTrailing();
    }
}
