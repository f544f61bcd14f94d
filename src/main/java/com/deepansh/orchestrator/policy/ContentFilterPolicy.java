package com.deepansh.orchestrator.policy;

import lombok.extern.slf4j.Slf4j;

/**
 * Caps the length of final responses.
 */
@Slf4j
public class ContentFilterPolicy implements AgentPolicy {

    public static final int DEFAULT_MAX_LENGTH = 4000;
    static final String TRUNCATION_MARKER = "...[truncated]";

    private final int maxLength;

    public ContentFilterPolicy() {
        this(DEFAULT_MAX_LENGTH);
    }

    public ContentFilterPolicy(int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive, got " + maxLength);
        }
        this.maxLength = maxLength;
    }

    @Override
    public String getName() {
        return "content_filter";
    }

    @Override
    public String filterResponse(String response) {
        if (response == null || response.length() <= maxLength) {
            return response;
        }
        log.debug("Truncating response from {} to {} chars", response.length(), maxLength);
        return response.substring(0, maxLength) + TRUNCATION_MARKER;
    }
}
