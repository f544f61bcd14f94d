package com.deepansh.orchestrator.agent;

import com.deepansh.orchestrator.config.AgentProperties;
import com.deepansh.orchestrator.core.state.StrategyType;
import com.deepansh.orchestrator.exception.NotFoundException;
import com.deepansh.orchestrator.generation.GenerationClient;
import com.deepansh.orchestrator.policy.AgentPolicy;
import com.deepansh.orchestrator.tool.AgentTool;
import com.deepansh.orchestrator.tool.ToolRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates agents by strategy name or named preset, resolving tool names against the
 * shared tool catalog and policy names against the built-in policies.
 */
@Component
@Slf4j
public class AgentFactory {

    private final GenerationClient generationClient;
    private final ToolRegistry toolCatalog;
    private final Map<String, AgentPolicy> policyCatalog;
    private final AgentProperties agentProperties;
    private final AsyncTaskExecutor executor;
    private final ObjectMapper objectMapper;

    public AgentFactory(GenerationClient generationClient,
                        @Qualifier("toolCatalog") ToolRegistry toolCatalog,
                        List<AgentPolicy> policies,
                        AgentProperties agentProperties,
                        @Qualifier("agentStepExecutor") AsyncTaskExecutor executor,
                        ObjectMapper objectMapper) {
        this.generationClient = generationClient;
        this.toolCatalog = toolCatalog;
        Map<String, AgentPolicy> byName = new LinkedHashMap<>();
        policies.forEach(p -> byName.put(p.getName(), p));
        this.policyCatalog = Collections.unmodifiableMap(byName);
        this.agentProperties = agentProperties;
        this.executor = executor;
        this.objectMapper = objectMapper;
    }

    /**
     * @throws com.deepansh.orchestrator.exception.UnknownStrategyException for an unknown strategy
     * @throws com.deepansh.orchestrator.exception.ToolNotFoundException    for an unknown tool name
     * @throws NotFoundException                                            for an unknown policy name
     */
    public Agent createAgent(String strategyName, AgentConfig config) {
        StrategyType strategy = StrategyType.fromName(strategyName);
        config.validate();

        Agent agent = Agent.builder()
                .strategy(strategy)
                .generationClient(generationClient)
                .config(config)
                .tools(resolveTools(config.getTools()))
                .policies(resolvePolicies(config.getPolicies()))
                .executor(executor)
                .objectMapper(objectMapper)
                .build();

        log.info("Created {} agent [tools={}, policies={}]",
                strategy.strategyName(), agent.getTools().list(), config.getPolicies());
        return agent;
    }

    /** Agent with the configured defaults */
    public Agent createAgent(String strategyName) {
        return createAgent(strategyName, agentProperties.toAgentConfig());
    }

    /**
     * @throws NotFoundException for an unknown preset
     */
    public Agent createFromPreset(String presetName) {
        AgentProperties.Preset preset = agentProperties.getPresets().get(presetName);
        if (preset == null) {
            throw new NotFoundException("Unknown preset '" + presetName + "'. Available presets: "
                    + agentProperties.getPresets().keySet());
        }
        log.debug("Creating agent from preset '{}' [strategy={}]", presetName, preset.getStrategy());
        return createAgent(preset.getStrategy(), preset.applyTo(agentProperties.toAgentConfig()));
    }

    public List<String> presetNames() {
        return List.copyOf(agentProperties.getPresets().keySet());
    }

    private List<AgentTool> resolveTools(List<String> names) {
        List<String> wanted = names != null ? names : toolCatalog.list();
        List<AgentTool> tools = new ArrayList<>(wanted.size());
        for (String name : wanted) {
            tools.add(toolCatalog.get(name));
        }
        return tools;
    }

    private List<AgentPolicy> resolvePolicies(List<String> names) {
        if (names == null) {
            return List.of();
        }
        List<AgentPolicy> resolved = new ArrayList<>(names.size());
        for (String name : names) {
            AgentPolicy policy = policyCatalog.get(name);
            if (policy == null) {
                throw new NotFoundException("Unknown policy '" + name + "'. Available policies: "
                        + policyCatalog.keySet());
            }
            resolved.add(policy);
        }
        return resolved;
    }
}
