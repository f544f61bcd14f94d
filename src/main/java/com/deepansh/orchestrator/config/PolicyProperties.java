package com.deepansh.orchestrator.config;

import com.deepansh.orchestrator.policy.ContentFilterPolicy;
import com.deepansh.orchestrator.policy.SafetyPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "policies")
@Data
public class PolicyProperties {

    private Safety safety = new Safety();
    private ContentFilter contentFilter = new ContentFilter();
    private Allowlist allowlist = new Allowlist();

    @Data
    public static class Safety {
        private List<String> blockedPatterns = new ArrayList<>(SafetyPolicy.DEFAULT_BLOCKED_PATTERNS);
    }

    @Data
    public static class ContentFilter {
        private int maxLength = ContentFilterPolicy.DEFAULT_MAX_LENGTH;
    }

    @Data
    public static class Allowlist {
        /** Tools the "tool_allowlist" policy lets through */
        private List<String> tools = new ArrayList<>();
    }
}
