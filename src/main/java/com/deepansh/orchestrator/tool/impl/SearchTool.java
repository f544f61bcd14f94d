package com.deepansh.orchestrator.tool.impl;

import com.deepansh.orchestrator.tool.AgentTool;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Adapts a caller-supplied search function to the tool contract.
 * Not part of the default set: there is no search backend to default to.
 */
@Slf4j
public class SearchTool implements AgentTool {

    private final Function<String, List<String>> searchFunction;

    public SearchTool(Function<String, List<String>> searchFunction) {
        this.searchFunction = searchFunction;
    }

    @Override
    public String getName() {
        return "search";
    }

    @Override
    public String getDescription() {
        return "Search for information using the provided query.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "query", Map.of(
                                "type", "string",
                                "description", "The search query"
                        )
                ),
                "required", List.of("query")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        Object query = arguments.get("query");
        if (query == null || query.toString().isBlank()) {
            return "ERROR: 'query' is required";
        }

        List<String> results;
        try {
            results = searchFunction.apply(query.toString());
        } catch (RuntimeException e) {
            log.warn("Search failed for '{}': {}", query, e.getMessage());
            return "ERROR: Search error: " + e.getMessage();
        }

        if (results == null || results.isEmpty()) {
            return "No results found for: " + query;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < results.size(); i++) {
            sb.append(i + 1).append(". ").append(results.get(i)).append("\n");
        }
        return sb.toString().stripTrailing();
    }
}
