package com.deepansh.orchestrator.policy;

import com.deepansh.orchestrator.model.ToolCall;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Blocks destructive actions and redacts the same patterns from responses.
 *
 * Matching is case-insensitive over every argument value of the action, so the
 * check does not depend on which parameter a tool happens to use for commands.
 * The default list covers shell wipes, DDL statements, shutdown commands and path
 * traversal.
 */
@Slf4j
public class SafetyPolicy implements AgentPolicy {

    public static final List<String> DEFAULT_BLOCKED_PATTERNS = List.of(
            "rm -rf", "drop table", "drop database", "truncate table",
            "shutdown", "mkfs", "format c:", "../");

    private static final String REDACTED = "[REDACTED]";

    private final List<String> blockedPatterns;

    public SafetyPolicy() {
        this(DEFAULT_BLOCKED_PATTERNS);
    }

    public SafetyPolicy(List<String> blockedPatterns) {
        this.blockedPatterns = blockedPatterns.stream()
                .map(p -> p.toLowerCase(Locale.ROOT))
                .filter(p -> !p.isBlank())
                .toList();
    }

    @Override
    public String getName() {
        return "safety";
    }

    @Override
    public PolicyDecision validateAction(ToolCall action) {
        Map<String, Object> arguments = action.getArguments();
        if (arguments == null || arguments.isEmpty()) {
            return PolicyDecision.allow();
        }
        for (Map.Entry<String, Object> entry : arguments.entrySet()) {
            String value = String.valueOf(entry.getValue()).toLowerCase(Locale.ROOT);
            for (String pattern : blockedPatterns) {
                if (value.contains(pattern)) {
                    return PolicyDecision.reject(String.format(
                            "argument '%s' contains blocked pattern '%s'", entry.getKey(), pattern));
                }
            }
        }
        return PolicyDecision.allow();
    }

    @Override
    public String filterResponse(String response) {
        if (response == null) {
            return null;
        }
        String filtered = response;
        for (String pattern : blockedPatterns) {
            filtered = Pattern.compile(Pattern.quote(pattern), Pattern.CASE_INSENSITIVE)
                    .matcher(filtered)
                    .replaceAll(REDACTED);
        }
        if (!filtered.equals(response)) {
            log.info("Safety policy redacted blocked content from response");
        }
        return filtered;
    }
}
