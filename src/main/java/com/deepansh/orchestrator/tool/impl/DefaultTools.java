package com.deepansh.orchestrator.tool.impl;

import com.deepansh.orchestrator.config.ToolProperties;
import com.deepansh.orchestrator.tool.AgentTool;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Factories for the built-in tools, in their canonical registration order.
 */
public final class DefaultTools {

    private DefaultTools() {
    }

    public static Map<String, Supplier<AgentTool>> factories(ToolProperties properties) {
        Map<String, Supplier<AgentTool>> factories = new LinkedHashMap<>();
        factories.put("calculator", () -> new CalculatorTool(properties.getCalculator()));
        factories.put("filesystem", () -> new FileSystemTool(properties.getFilesystem()));
        factories.put("web", () -> new WebTool(properties.getWeb()));
        factories.put("data_analysis", DataAnalysisTool::new);
        factories.put("time", TimeTool::new);
        return factories;
    }
}
