package com.deepansh.orchestrator.generation;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Creates the raw provider client. Agents receive the resilient decorator,
 * which is the primary {@link GenerationClient} bean.
 */
@Configuration
@Slf4j
public class GenerationClientConfig {

    private final GenerationProperties props;

    public GenerationClientConfig(GenerationProperties props) {
        this.props = props;
    }

    @PostConstruct
    public void logActiveProvider() {
        log.info("================================================================");
        log.info("  Generation provider : {}", props.getProvider().toUpperCase());
        log.info("  Model               : {}", props.getModel());
        log.info("  Base URL            : {}", props.getBaseUrl());
        log.info("================================================================");
        String key = props.getApiKey();
        if (key == null || key.isBlank()) {
            log.warn("  generation.api-key is not set; generation calls will fail until it is");
        }
    }

    @Bean("providerGenerationClient")
    public GenerationClient providerGenerationClient(RestClient.Builder builder) {
        return new OpenAiCompatibleGenerationClient(props, builder.clone());
    }
}
