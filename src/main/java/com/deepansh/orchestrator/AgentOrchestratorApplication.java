package com.deepansh.orchestrator;

import com.deepansh.orchestrator.config.AgentProperties;
import com.deepansh.orchestrator.config.PolicyProperties;
import com.deepansh.orchestrator.config.ToolProperties;
import com.deepansh.orchestrator.generation.GenerationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AgentProperties.class,
        ToolProperties.class,
        PolicyProperties.class,
        GenerationProperties.class
})
public class AgentOrchestratorApplication {
    public static void main(String[] args) {
        SpringApplication.run(AgentOrchestratorApplication.class, args);
    }
}
