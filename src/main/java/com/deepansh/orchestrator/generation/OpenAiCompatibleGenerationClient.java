package com.deepansh.orchestrator.generation;

import com.deepansh.orchestrator.exception.GenerationException;
import com.deepansh.orchestrator.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Generation over an OpenAI-compatible /chat/completions endpoint.
 *
 * Error mapping:
 *
 * | Error           | Exception                                  |
 * |-----------------|--------------------------------------------|
 * | 401, other 4xx  | GenerationException (not retried)          |
 * | 429, 5xx        | TransientGenerationException (retried)     |
 * | network error   | TransientGenerationException (retried)     |
 * | no choices      | GenerationException                        |
 *
 * Context roles map onto chat roles: user → user, agent → assistant, and tool
 * observations become user messages prefixed with the tool name, since they were
 * not produced by native tool calling.
 */
@Slf4j
public class OpenAiCompatibleGenerationClient implements GenerationClient {

    private final GenerationProperties props;
    private final RestClient restClient;

    public OpenAiCompatibleGenerationClient(GenerationProperties props, RestClient.Builder restClientBuilder) {
        this.props = props;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public String generate(String prompt, List<Message> context) {
        return generate(prompt, context, SamplingParameters.builder()
                .temperature(props.getTemperature())
                .maxTokens(props.getMaxTokens())
                .build());
    }

    @Override
    public String generate(String prompt, List<Message> context, SamplingParameters sampling) {
        Map<String, Object> requestBody = buildRequestBody(prompt, context, sampling);

        log.debug("Sending {} messages to {} [model={}]",
                context.size() + 1, props.getProvider(), props.getModel());

        Map<String, Object> response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::is4xxClientError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 4xx [{}]: {}", props.getProvider(), res.getStatusCode(), body);
                        handle4xxError(body, res.getStatusCode().value());
                    })
                    .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} 5xx [{}]: {}", props.getProvider(), res.getStatusCode(), body);
                        throw new TransientGenerationException(
                                props.getProvider() + " server error [" + res.getStatusCode() + "]: " + body);
                    })
                    .body(new ParameterizedTypeReference<>() {});
        } catch (ResourceAccessException e) {
            throw new TransientGenerationException(props.getProvider() + " unreachable: " + e.getMessage(), e);
        }

        return parseResponse(response);
    }

    private void handle4xxError(String body, int statusCode) {
        if (statusCode == 401) {
            throw new GenerationException(props.getProvider()
                    + " API key is invalid. Check generation.api-key.");
        }
        if (statusCode == 429) {
            throw new TransientGenerationException(props.getProvider() + " rate limit exceeded. Will retry.");
        }
        throw new GenerationException(props.getProvider() + " client error [" + statusCode + "]: " + body);
    }

    private Map<String, Object> buildRequestBody(String prompt, List<Message> context, SamplingParameters sampling) {
        List<Map<String, Object>> messages = new ArrayList<>();
        for (Message msg : context) {
            messages.add(formatMessage(msg));
        }
        messages.add(Map.of("role", "user", "content", prompt));

        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", sampling.getMaxTokens());
        body.put("temperature", sampling.getTemperature());
        body.put("messages", messages);
        return body;
    }

    private Map<String, Object> formatMessage(Message msg) {
        String content = msg.getContent() != null ? msg.getContent() : "";
        return switch (msg.getRole()) {
            case user -> Map.of("role", "user", "content", content);
            case agent -> Map.of("role", "assistant", "content", content);
            case tool -> Map.of("role", "user", "content",
                    "Observation from " + msg.getMetadata().getOrDefault("tool", "tool") + ": " + content);
        };
    }

    @SuppressWarnings("unchecked")
    private String parseResponse(Map<String, Object> response) {
        if (response == null) {
            throw new GenerationException(props.getProvider() + " returned an empty response");
        }
        List<Map<String, Object>> choices = (List<Map<String, Object>>) response.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new GenerationException(props.getProvider() + " returned no choices in response");
        }

        Map<String, Object> usage = (Map<String, Object>) response.get("usage");
        if (usage != null) {
            log.debug("Token usage: prompt={} completion={}",
                    usage.getOrDefault("prompt_tokens", 0), usage.getOrDefault("completion_tokens", 0));
        }

        Map<String, Object> message = (Map<String, Object>) choices.get(0).get("message");
        Object content = message == null ? null : message.get("content");
        if (content == null) {
            throw new GenerationException(props.getProvider() + " returned a choice without content");
        }
        return content.toString();
    }
}
