package com.deepansh.orchestrator.agent;

import com.deepansh.orchestrator.core.ReActOutputParser;
import com.deepansh.orchestrator.core.StateMachines;
import com.deepansh.orchestrator.core.state.AgentStateCodec;
import com.deepansh.orchestrator.core.state.StrategyType;
import com.deepansh.orchestrator.generation.GenerationClient;
import com.deepansh.orchestrator.memory.Memory;
import com.deepansh.orchestrator.memory.MemoryFactory;
import com.deepansh.orchestrator.policy.AgentPolicy;
import com.deepansh.orchestrator.policy.PolicyChain;
import com.deepansh.orchestrator.resilience.BoundedExecution;
import com.deepansh.orchestrator.tool.AgentTool;
import com.deepansh.orchestrator.tool.ToolRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Fluent assembly of an {@link Agent}. Nothing is created until {@link #build()}.
 *
 * Defaults: reflection strategy, conversation memory, the default policy chain
 * (safety + content filter) and a shared daemon thread pool for suspension points.
 */
public class AgentBuilder {

    private StrategyType strategy = StrategyType.REFLECTION;
    private GenerationClient generationClient;
    private Memory memory;
    private final List<AgentTool> tools = new ArrayList<>();
    private final List<AgentPolicy> policies = new ArrayList<>();
    private boolean defaultPolicies = true;
    private AgentConfig config = AgentConfig.builder().build();
    private AsyncTaskExecutor executor;
    private ObjectMapper objectMapper;

    public AgentBuilder strategy(StrategyType strategy) {
        this.strategy = strategy;
        return this;
    }

    /**
     * @throws com.deepansh.orchestrator.exception.UnknownStrategyException for an unknown name
     */
    public AgentBuilder strategy(String strategyName) {
        return strategy(StrategyType.fromName(strategyName));
    }

    public AgentBuilder generationClient(GenerationClient generationClient) {
        this.generationClient = generationClient;
        return this;
    }

    public AgentBuilder memory(Memory memory) {
        this.memory = memory;
        return this;
    }

    public AgentBuilder tool(AgentTool tool) {
        tools.add(tool);
        return this;
    }

    public AgentBuilder tools(Collection<? extends AgentTool> tools) {
        this.tools.addAll(tools);
        return this;
    }

    /**
     * Adding any policy replaces the default chain with the policies added.
     */
    public AgentBuilder policy(AgentPolicy policy) {
        policies.add(policy);
        defaultPolicies = false;
        return this;
    }

    public AgentBuilder policies(Collection<? extends AgentPolicy> policies) {
        this.policies.addAll(policies);
        defaultPolicies = false;
        return this;
    }

    /** An agent with no policies at all */
    public AgentBuilder noPolicies() {
        policies.clear();
        defaultPolicies = false;
        return this;
    }

    /** Replaces every scalar setting; later scalar calls still apply on top */
    public AgentBuilder config(AgentConfig config) {
        this.config = config.toBuilder().build();
        return this;
    }

    public AgentBuilder maxSteps(int maxSteps) {
        config.setMaxSteps(maxSteps);
        return this;
    }

    public AgentBuilder maxReflections(int maxReflections) {
        config.setMaxReflections(maxReflections);
        return this;
    }

    public AgentBuilder maxReplans(int maxReplans) {
        config.setMaxReplans(maxReplans);
        return this;
    }

    public AgentBuilder temperature(double temperature) {
        config.setTemperature(temperature);
        return this;
    }

    public AgentBuilder maxTokens(int maxTokens) {
        config.setMaxTokens(maxTokens);
        return this;
    }

    public AgentBuilder toolTimeout(Duration toolTimeout) {
        config.setToolTimeout(toolTimeout);
        return this;
    }

    public AgentBuilder generationTimeout(Duration generationTimeout) {
        config.setGenerationTimeout(generationTimeout);
        return this;
    }

    public AgentBuilder executor(AsyncTaskExecutor executor) {
        this.executor = executor;
        return this;
    }

    public AgentBuilder objectMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        return this;
    }

    /**
     * @throws IllegalStateException    when no generation client was given
     * @throws IllegalArgumentException when a limit is out of range
     * @throws com.deepansh.orchestrator.exception.DuplicateToolException when two tools share a name
     */
    public Agent build() {
        if (generationClient == null) {
            throw new IllegalStateException("A generation client is required to build an agent");
        }
        AgentConfig frozen = config.toBuilder().build();
        frozen.validate();

        ToolRegistry registry = new ToolRegistry();
        tools.forEach(registry::register);

        PolicyChain chain = defaultPolicies ? PolicyChain.defaults() : new PolicyChain(policies);
        Memory agentMemory = memory != null ? memory : MemoryFactory.create(frozen.toMemoryProperties());
        ObjectMapper mapper = objectMapper != null ? objectMapper : new ObjectMapper();
        AsyncTaskExecutor taskExecutor = executor != null ? executor : SharedExecutor.INSTANCE;

        return new Agent(
                StateMachines.create(strategy, new ReActOutputParser(mapper)),
                generationClient,
                frozen,
                registry,
                chain,
                agentMemory,
                new BoundedExecution(taskExecutor),
                new AgentStateCodec(mapper));
    }

    /** Lazily started pool for agents built outside Spring */
    private static final class SharedExecutor {

        static final ThreadPoolTaskExecutor INSTANCE = create();

        private static ThreadPoolTaskExecutor create() {
            ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
            executor.setCorePoolSize(4);
            executor.setMaxPoolSize(16);
            executor.setQueueCapacity(100);
            executor.setThreadNamePrefix("agent-step-");
            executor.setDaemon(true);
            executor.initialize();
            return executor;
        }
    }
}
