package com.deepansh.orchestrator.tool.impl;

import com.deepansh.orchestrator.tool.AgentTool;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Basic data analysis: text/list summaries and descriptive statistics over numbers.
 * Statistics accept a JSON-style list of numbers or a comma-separated string.
 */
public class DataAnalysisTool implements AgentTool {

    private final ObjectMapper objectMapper;

    public DataAnalysisTool() {
        this(new ObjectMapper());
    }

    public DataAnalysisTool(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return "data_analysis";
    }

    @Override
    public String getDescription() {
        return "Perform basic data analysis: 'summarize' text or a list, or compute 'statistics' "
                + "(count, mean, median, min, max) over a list of numbers.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "operation", Map.of(
                                "type", "string",
                                "enum", List.of("summarize", "statistics"),
                                "description", "The analysis to perform"
                        ),
                        "data", Map.of(
                                "type", "string/list",
                                "description", "Text, a list of values, or comma-separated numbers"
                        )
                ),
                "required", List.of("operation", "data")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        Object operation = arguments.get("operation");
        Object data = arguments.get("data");
        if (operation == null) {
            return "ERROR: 'operation' is required (summarize, statistics)";
        }
        if (data == null) {
            return "ERROR: 'data' is required";
        }

        return switch (operation.toString().toLowerCase()) {
            case "summarize" -> summarize(data);
            case "statistics" -> statistics(data);
            default -> "ERROR: Unsupported data operation '" + operation + "'";
        };
    }

    private String summarize(Object data) {
        if (data instanceof String text) {
            int words = text.isBlank() ? 0 : text.trim().split("\\s+").length;
            int lines = text.split("\n", -1).length;
            return String.format("Text summary: %d words, %d characters, %d lines", words, text.length(), lines);
        }
        if (data instanceof Collection<?> items) {
            return "List summary: " + items.size() + " items";
        }
        return "Data type: " + data.getClass().getSimpleName();
    }

    private String statistics(Object data) {
        List<Double> values = toNumbers(data);
        if (values == null || values.isEmpty()) {
            return "ERROR: Statistics only available for numeric lists";
        }

        List<Double> sorted = new ArrayList<>(values);
        sorted.sort(Double::compare);
        int n = sorted.size();
        double median = n % 2 == 1
                ? sorted.get(n / 2)
                : (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;

        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("count", n);
        stats.put("mean", values.stream().mapToDouble(Double::doubleValue).average().orElse(0));
        stats.put("median", median);
        stats.put("min", sorted.get(0));
        stats.put("max", sorted.get(n - 1));

        try {
            return objectMapper.writeValueAsString(stats);
        } catch (JsonProcessingException e) {
            return stats.toString();
        }
    }

    /** Null when any element is not numeric */
    private List<Double> toNumbers(Object data) {
        Collection<?> raw;
        if (data instanceof Collection<?> items) {
            raw = items;
        } else if (data instanceof String text) {
            raw = Arrays.stream(text.replace("[", "").replace("]", "").split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
        } else {
            return null;
        }

        List<Double> values = new ArrayList<>();
        for (Object item : raw) {
            if (item instanceof Number number) {
                values.add(number.doubleValue());
            } else {
                try {
                    values.add(Double.parseDouble(String.valueOf(item)));
                } catch (NumberFormatException e) {
                    return null;
                }
            }
        }
        return values;
    }
}
