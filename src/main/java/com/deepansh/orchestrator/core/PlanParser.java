package com.deepansh.orchestrator.core;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns generated plan text into step descriptions.
 *
 * Numbered ({@code 1.} / {@code 1)}) and bulleted ({@code -} / {@code *}) lines are
 * steps. When no line carries such a prefix, every non-blank line is a step.
 */
public final class PlanParser {

    private static final Pattern STEP_LINE = Pattern.compile("^\\s*(?:\\d+[.)]|[-*])\\s+(.+)$");

    private PlanParser() {
    }

    public static List<String> parse(String text, int maxSteps) {
        if (text == null || text.isBlank() || maxSteps <= 0) {
            return List.of();
        }
        String[] lines = text.split("\\R");

        List<String> steps = new ArrayList<>();
        for (String line : lines) {
            Matcher m = STEP_LINE.matcher(line);
            if (m.matches() && !m.group(1).isBlank()) {
                steps.add(m.group(1).trim());
            }
        }
        if (steps.isEmpty()) {
            for (String line : lines) {
                if (!line.isBlank()) {
                    steps.add(line.trim());
                }
            }
        }
        return steps.size() > maxSteps ? List.copyOf(steps.subList(0, maxSteps)) : List.copyOf(steps);
    }
}
