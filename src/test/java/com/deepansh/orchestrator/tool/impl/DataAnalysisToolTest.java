package com.deepansh.orchestrator.tool.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DataAnalysisToolTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final DataAnalysisTool tool = new DataAnalysisTool(objectMapper);

    @Test
    void statistics_overNumericList() throws Exception {
        String result = tool.execute(Map.of("operation", "statistics", "data", List.of(3, 1, 4, 1, 5)));

        JsonNode stats = objectMapper.readTree(result);
        assertThat(stats.get("count").asInt()).isEqualTo(5);
        assertThat(stats.get("mean").asDouble()).isEqualTo(2.8);
        assertThat(stats.get("median").asDouble()).isEqualTo(3.0);
        assertThat(stats.get("min").asDouble()).isEqualTo(1.0);
        assertThat(stats.get("max").asDouble()).isEqualTo(5.0);
    }

    @Test
    void statistics_evenCount_medianIsMidpoint() throws Exception {
        String result = tool.execute(Map.of("operation", "statistics", "data", "1, 2, 3, 10"));
        assertThat(objectMapper.readTree(result).get("median").asDouble()).isEqualTo(2.5);
    }

    @Test
    void statistics_nonNumeric_returnsError() {
        assertThat(tool.execute(Map.of("operation", "statistics", "data", List.of("a", "b"))))
                .startsWith("ERROR:");
    }

    @Test
    void summarize_text() {
        assertThat(tool.execute(Map.of("operation", "summarize", "data", "one two three")))
                .isEqualTo("Text summary: 3 words, 13 characters, 1 lines");
    }

    @Test
    void summarize_list() {
        assertThat(tool.execute(Map.of("operation", "summarize", "data", List.of(1, 2))))
                .isEqualTo("List summary: 2 items");
    }

    @Test
    void missingData_returnsError() {
        assertThat(tool.execute(Map.of("operation", "summarize"))).startsWith("ERROR:");
    }
}
