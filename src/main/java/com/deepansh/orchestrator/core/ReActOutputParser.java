package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.model.ToolCall;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the Thought / Action / Action Input / Final Answer convention out of
 * generated text.
 *
 * A final answer wins over an action. Text with neither is the final answer.
 * Action Input that is not a JSON object yields {@code {"raw": <text>}}.
 */
@Slf4j
public class ReActOutputParser {

    private static final Pattern THOUGHT = Pattern.compile(
            "(?is)Thought:\\s*(.*?)(?=\\n\\s*(?:Action:|Action Input:|Final Answer:)|$)");
    private static final Pattern ACTION = Pattern.compile("(?im)^\\s*Action:\\s*(.+?)\\s*$");
    private static final Pattern ACTION_INPUT = Pattern.compile(
            "(?is)Action Input:\\s*(.*?)(?=\\n\\s*(?:Thought:|Observation:|Final Answer:)|$)");
    private static final Pattern FINAL_ANSWER = Pattern.compile("(?is)Final Answer:\\s*(.*)$");

    private final ObjectMapper objectMapper;

    public ReActOutputParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Parsed parse(String text) {
        String source = text == null ? "" : text.trim();
        String thought = group(THOUGHT, source);

        String finalAnswer = group(FINAL_ANSWER, source);
        if (finalAnswer != null) {
            return new Parsed(thought, null, finalAnswer);
        }

        String toolName = group(ACTION, source);
        if (toolName == null || toolName.isBlank()) {
            return new Parsed(thought, null, source);
        }

        ToolCall action = ToolCall.builder()
                .id("call-" + UUID.randomUUID().toString().substring(0, 8))
                .toolName(stripQuotes(toolName.trim()))
                .arguments(parseArguments(group(ACTION_INPUT, source)))
                .build();
        return new Parsed(thought, action, null);
    }

    private Map<String, Object> parseArguments(String raw) {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        String json = stripCodeFence(raw.trim());
        try {
            Map<String, Object> args = objectMapper.readValue(json, new TypeReference<>() {});
            return args == null ? Map.of() : args;
        } catch (JsonProcessingException e) {
            log.debug("Action Input is not a JSON object, passing it raw: {}", json);
            Map<String, Object> args = new HashMap<>();
            args.put("raw", json);
            return args;
        }
    }

    private static String stripCodeFence(String text) {
        if (text.startsWith("```")) {
            String body = text.replaceFirst("^```[a-zA-Z]*\\s*", "");
            int end = body.lastIndexOf("```");
            return (end >= 0 ? body.substring(0, end) : body).trim();
        }
        return text;
    }

    private static String stripQuotes(String name) {
        return name.replaceAll("^[`'\"]+|[`'\"]+$", "");
    }

    private static String group(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        return m.find() ? m.group(1).trim() : null;
    }

    /**
     * Exactly one of {@code action} and {@code finalAnswer} is non-null.
     */
    public record Parsed(String thought, ToolCall action, String finalAnswer) {

        public boolean isFinal() {
            return finalAnswer != null;
        }
    }
}
