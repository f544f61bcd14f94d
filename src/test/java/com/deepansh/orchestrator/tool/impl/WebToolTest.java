package com.deepansh.orchestrator.tool.impl;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WebToolTest {

    private final WebTool tool = new WebTool();

    @Test
    void missingUrl_returnsError() {
        assertThat(tool.execute(Map.of("operation", "fetch"))).isEqualTo("ERROR: 'url' is required");
    }

    @Test
    void nonHttpScheme_isRefused() {
        assertThat(tool.execute(Map.of("operation", "fetch", "url", "file:///etc/passwd")))
                .isEqualTo("ERROR: Only http and https urls are supported");
    }

    @Test
    void unsupportedOperation_returnsError() {
        assertThat(tool.execute(Map.of("operation", "post", "url", "https://example.com")))
                .startsWith("ERROR: Unsupported web operation");
    }

    @Test
    void unreachableHost_returnsError() {
        assertThat(tool.execute(Map.of("operation", "fetch", "url", "http://127.0.0.1:1/")))
                .startsWith("ERROR: Web operation error");
    }
}
