package com.deepansh.orchestrator.generation;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Provider settings for the OpenAI-compatible chat completions endpoint.
 * Works with OpenAI, Groq, Gemini's OpenAI surface or a local server.
 */
@ConfigurationProperties(prefix = "generation")
@Data
public class GenerationProperties {

    private String provider = "openai";
    private String baseUrl = "https://api.openai.com/v1";
    private String apiKey = "";
    private String model = "gpt-4o-mini";
    private int maxTokens = 1024;
    private double temperature = 0.7;
}
