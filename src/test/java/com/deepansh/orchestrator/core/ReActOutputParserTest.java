package com.deepansh.orchestrator.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReActOutputParserTest {

    private final ReActOutputParser parser = new ReActOutputParser(new ObjectMapper());

    @Test
    void parsesActionWithJsonInput() {
        ReActOutputParser.Parsed parsed = parser.parse("""
                Thought: I should add the numbers
                Action: calculator
                Action Input: {"expression": "2 + 2"}
                """);

        assertThat(parsed.isFinal()).isFalse();
        assertThat(parsed.thought()).isEqualTo("I should add the numbers");
        assertThat(parsed.action().getToolName()).isEqualTo("calculator");
        assertThat(parsed.action().getArguments()).containsEntry("expression", "2 + 2");
        assertThat(parsed.action().getId()).isNotBlank();
    }

    @Test
    void parsesFinalAnswer() {
        ReActOutputParser.Parsed parsed = parser.parse("Thought: done\nFinal Answer: 4");

        assertThat(parsed.isFinal()).isTrue();
        assertThat(parsed.finalAnswer()).isEqualTo("4");
        assertThat(parsed.action()).isNull();
    }

    @Test
    void finalAnswerWinsOverAction() {
        ReActOutputParser.Parsed parsed = parser.parse("Action: calculator\nFinal Answer: 7");
        assertThat(parsed.finalAnswer()).isEqualTo("7");
    }

    @Test
    void plainText_isTheFinalAnswer() {
        ReActOutputParser.Parsed parsed = parser.parse("Paris is the capital of France.");
        assertThat(parsed.finalAnswer()).isEqualTo("Paris is the capital of France.");
    }

    @Test
    void malformedJson_becomesRawArgument() {
        ReActOutputParser.Parsed parsed = parser.parse("Action: web\nAction Input: fetch example.com");

        assertThat(parsed.action().getArguments()).containsOnlyKeys("raw");
        assertThat(parsed.action().getArguments()).containsEntry("raw", "fetch example.com");
    }

    @Test
    void codeFencedJson_isUnwrapped() {
        ReActOutputParser.Parsed parsed = parser.parse("""
                Action: `time`
                Action Input: ```json
                {"timezone": "UTC"}
                ```
                """);

        assertThat(parsed.action().getToolName()).isEqualTo("time");
        assertThat(parsed.action().getArguments()).containsEntry("timezone", "UTC");
    }
}
