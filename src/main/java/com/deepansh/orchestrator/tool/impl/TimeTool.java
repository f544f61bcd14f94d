package com.deepansh.orchestrator.tool.impl;

import com.deepansh.orchestrator.tool.AgentTool;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

public class TimeTool implements AgentTool {

    private final Clock clock;

    public TimeTool() {
        this(Clock.systemDefaultZone());
    }

    public TimeTool(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String getName() {
        return "time";
    }

    @Override
    public String getDescription() {
        return "Get the current date and time in ISO-8601 format, optionally for a given timezone.";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "timezone", Map.of(
                                "type", "string",
                                "description", "Optional IANA zone id, e.g. 'Europe/London'"
                        )
                )
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        Object zone = arguments.get("timezone");
        ZonedDateTime now = ZonedDateTime.now(clock);
        if (zone != null && !zone.toString().isBlank()) {
            try {
                now = now.withZoneSameInstant(ZoneId.of(zone.toString().trim()));
            } catch (DateTimeException e) {
                return "ERROR: Unknown timezone '" + zone + "'";
            }
        }
        return now.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }
}
