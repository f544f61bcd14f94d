package com.deepansh.orchestrator.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Arrays;
import java.util.List;

/**
 * Strongly-typed configuration for the built-in tools.
 * Bound from application.yml under the "tools" prefix; the defaults below are
 * what {@code ToolRegistry.createDefaultSet()} uses outside Spring.
 */
@ConfigurationProperties(prefix = "tools")
@Data
public class ToolProperties {

    private Calculator calculator = new Calculator();
    private Filesystem filesystem = new Filesystem();
    private Web web = new Web();

    @Data
    public static class Calculator {
        /** Digits kept after the decimal point for non-terminating divisions */
        private int scale = 10;
    }

    @Data
    public static class Filesystem {
        private String baseDirectory = "./agent-files";
        private int maxFileSizeKb = 512;
        private String allowedExtensions = "txt,md,json,csv,yaml,yml,log";

        public List<String> getAllowedExtensionList() {
            return Arrays.stream(allowedExtensions.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isBlank())
                    .toList();
        }
    }

    @Data
    public static class Web {
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 10000;
        private int maxContentChars = 2000;
    }
}
