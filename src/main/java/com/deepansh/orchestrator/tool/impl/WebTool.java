package com.deepansh.orchestrator.tool.impl;

import com.deepansh.orchestrator.config.ToolProperties;
import com.deepansh.orchestrator.tool.AgentTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * Fetches web pages or their headers over HTTP(S).
 *
 * Output is capped at max-content-chars so a large page cannot flood the
 * conversation. Network and HTTP errors come back as error strings.
 */
@Slf4j
public class WebTool implements AgentTool {

    private final ToolProperties.Web properties;
    private final RestClient restClient;

    public WebTool() {
        this(new ToolProperties.Web());
    }

    public WebTool(ToolProperties.Web properties) {
        this.properties = properties;
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getConnectTimeoutMs());
        requestFactory.setReadTimeout(properties.getReadTimeoutMs());
        this.restClient = RestClient.builder()
                .requestFactory(requestFactory)
                .build();
    }

    @Override
    public String getName() {
        return "web";
    }

    @Override
    public String getDescription() {
        return "Perform web operations like fetching webpage content ('fetch') or response headers ('headers').";
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "operation", Map.of(
                                "type", "string",
                                "enum", List.of("fetch", "headers"),
                                "description", "The web operation to perform"
                        ),
                        "url", Map.of(
                                "type", "string",
                                "description", "Absolute http(s) URL"
                        )
                ),
                "required", List.of("operation", "url")
        );
    }

    @Override
    public String execute(Map<String, Object> arguments) {
        Object operation = arguments.get("operation");
        Object url = arguments.get("url");

        if (url == null || url.toString().isBlank()) {
            return "ERROR: 'url' is required";
        }
        URI uri;
        try {
            uri = URI.create(url.toString().trim());
        } catch (IllegalArgumentException e) {
            return "ERROR: Invalid url '" + url + "'";
        }
        if (uri.getScheme() == null || !List.of("http", "https").contains(uri.getScheme().toLowerCase())) {
            return "ERROR: Only http and https urls are supported";
        }

        String op = operation == null ? "fetch" : operation.toString().toLowerCase();
        try {
            return switch (op) {
                case "fetch" -> fetch(uri);
                case "headers" -> headers(uri);
                default -> "ERROR: Unsupported web operation '" + operation + "'";
            };
        } catch (RestClientException e) {
            log.warn("Web operation failed [{} {}]: {}", op, uri, e.getMessage());
            return "ERROR: Web operation error: " + e.getMessage();
        }
    }

    private String fetch(URI uri) {
        String body = restClient.get()
                .uri(uri)
                .retrieve()
                .body(String.class);
        if (body == null) {
            return "";
        }
        log.debug("Fetched {} chars from {}", body.length(), uri);
        return body.length() <= properties.getMaxContentChars()
                ? body
                : body.substring(0, properties.getMaxContentChars());
    }

    private String headers(URI uri) {
        HttpHeaders headers = restClient.head()
                .uri(uri)
                .retrieve()
                .toBodilessEntity()
                .getHeaders();
        return headers.toSingleValueMap().toString();
    }
}
