package com.deepansh.orchestrator.config;

import com.deepansh.orchestrator.agent.AgentFactory;
import com.deepansh.orchestrator.agent.AgentRouter;
import com.deepansh.orchestrator.agent.WorkflowOrchestrator;
import com.deepansh.orchestrator.core.state.AgentStateCodec;
import com.deepansh.orchestrator.core.state.StrategyType;
import com.deepansh.orchestrator.policy.AgentPolicy;
import com.deepansh.orchestrator.policy.ContentFilterPolicy;
import com.deepansh.orchestrator.policy.SafetyPolicy;
import com.deepansh.orchestrator.policy.ToolAllowlistPolicy;
import com.deepansh.orchestrator.tool.ToolRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.HashSet;

/**
 * Shared catalogs: the tool registry that agent configs name tools from, and the
 * built-in policies that agent configs name policies from.
 */
@Configuration
@Slf4j
public class OrchestratorConfig {

    @Bean
    public ToolRegistry toolCatalog(ToolProperties toolProperties) {
        ToolRegistry registry = ToolRegistry.withDefaults(toolProperties);
        log.info("Tool catalog initialized with {} tools: {}", registry.size(), registry.list());
        return registry;
    }

    @Bean
    public AgentPolicy safetyPolicy(PolicyProperties properties) {
        return new SafetyPolicy(properties.getSafety().getBlockedPatterns());
    }

    @Bean
    public AgentPolicy contentFilterPolicy(PolicyProperties properties) {
        return new ContentFilterPolicy(properties.getContentFilter().getMaxLength());
    }

    @Bean
    public AgentPolicy toolAllowlistPolicy(PolicyProperties properties) {
        return new ToolAllowlistPolicy(new HashSet<>(properties.getAllowlist().getTools()));
    }

    /**
     * One default-configured agent per strategy behind keyword routing.
     */
    @Bean
    public AgentRouter agentRouter(AgentFactory agentFactory, AgentProperties agentProperties) {
        AgentRouter router = new AgentRouter(agentProperties.getRouter());
        for (StrategyType strategy : StrategyType.values()) {
            router.register(agentFactory.createAgent(strategy.strategyName()));
        }
        return router;
    }

    @Bean
    public WorkflowOrchestrator workflowOrchestrator() {
        return new WorkflowOrchestrator();
    }

    @Bean
    public AgentStateCodec agentStateCodec(ObjectMapper objectMapper) {
        return new AgentStateCodec(objectMapper);
    }
}
