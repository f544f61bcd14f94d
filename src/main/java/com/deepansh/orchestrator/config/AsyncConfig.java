package com.deepansh.orchestrator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool for the suspension points of agent runs: generation calls and tool calls.
 *
 * The calling thread only waits, so a call that times out is cancelled here without
 * blocking the run. Sized from agent.executor.*.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "agentStepExecutor")
    public ThreadPoolTaskExecutor agentStepExecutor(AgentProperties agentProperties) {
        AgentProperties.Executor props = agentProperties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix("agent-step-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
