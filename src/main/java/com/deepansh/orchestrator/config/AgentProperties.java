package com.deepansh.orchestrator.config;

import com.deepansh.orchestrator.agent.AgentConfig;
import com.deepansh.orchestrator.memory.MemoryProperties;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Agent defaults, presets and routing rules, bound from application.yml under "agent".
 */
@ConfigurationProperties(prefix = "agent")
@Validated
@Data
public class AgentProperties {

    @Min(1)
    private int maxSteps = 10;

    @Min(0)
    private int maxReflections = 3;

    @Min(0)
    private int maxReplans = 2;

    private double temperature = 0.7;

    @Min(1)
    private int maxTokens = 1024;

    @NotNull
    private Duration toolTimeout = Duration.ofSeconds(30);

    @NotNull
    private Duration generationTimeout = Duration.ofSeconds(60);

    @Valid
    private MemoryProperties memory = new MemoryProperties();

    /** Catalog tools for agents that name none; unset means all of them */
    private List<String> tools;

    private List<String> policies = new ArrayList<>(List.of("safety", "content_filter"));

    private Executor executor = new Executor();

    private Router router = new Router();

    private Map<String, Preset> presets = defaultPresets();

    /**
     * The configured defaults as a fresh, mutable {@link AgentConfig}.
     */
    public AgentConfig toAgentConfig() {
        return AgentConfig.builder()
                .maxSteps(maxSteps)
                .maxReflections(maxReflections)
                .maxReplans(maxReplans)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .toolTimeout(toolTimeout)
                .generationTimeout(generationTimeout)
                .memoryType(memory.getType())
                .maxHistory(memory.getMaxHistory())
                .contextTurns(memory.getContextTurns())
                .recallLimit(memory.getRecallLimit())
                .tools(tools == null ? null : List.copyOf(tools))
                .policies(List.copyOf(policies))
                .build();
    }

    @Data
    public static class Executor {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 100;
    }

    @Data
    public static class Router {
        private List<String> reactKeywords = new ArrayList<>(List.of(
                "calculate", "compute", "convert", "look up", "fetch", "current time"));
        private List<String> planningKeywords = new ArrayList<>(List.of(
                "plan", "steps", "organize", "schedule", "roadmap", "break down"));
    }

    /**
     * A named configuration. Unset fields fall back to the agent defaults.
     */
    @Data
    public static class Preset {
        @NotNull
        private String strategy;
        private Integer maxSteps;
        private Integer maxReflections;
        private Integer maxReplans;
        private Double temperature;
        private List<String> tools;
        private List<String> policies;

        public AgentConfig applyTo(AgentConfig base) {
            AgentConfig config = base.toBuilder().build();
            if (maxSteps != null) config.setMaxSteps(maxSteps);
            if (maxReflections != null) config.setMaxReflections(maxReflections);
            if (maxReplans != null) config.setMaxReplans(maxReplans);
            if (temperature != null) config.setTemperature(temperature);
            if (tools != null) config.setTools(List.copyOf(tools));
            if (policies != null) config.setPolicies(List.copyOf(policies));
            return config;
        }

        static Preset of(String strategy) {
            Preset preset = new Preset();
            preset.setStrategy(strategy);
            return preset;
        }
    }

    private static Map<String, Preset> defaultPresets() {
        Map<String, Preset> presets = new LinkedHashMap<>();

        Preset basicReflection = Preset.of("reflection");
        basicReflection.setMaxReflections(2);
        basicReflection.setTools(List.of());
        presets.put("basic_reflection", basicReflection);

        Preset toolUser = Preset.of("react");
        toolUser.setMaxSteps(8);
        toolUser.setTools(List.of("calculator", "web", "data_analysis", "time"));
        presets.put("tool_user", toolUser);

        Preset planner = Preset.of("planning");
        planner.setMaxSteps(10);
        planner.setMaxReplans(2);
        presets.put("planner", planner);

        return presets;
    }
}
