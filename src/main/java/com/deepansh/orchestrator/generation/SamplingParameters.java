package com.deepansh.orchestrator.generation;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SamplingParameters {

    @Builder.Default
    double temperature = 0.7;

    @Builder.Default
    int maxTokens = 1024;

    public static SamplingParameters defaults() {
        return SamplingParameters.builder().build();
    }
}
