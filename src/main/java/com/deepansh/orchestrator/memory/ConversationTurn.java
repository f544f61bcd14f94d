package com.deepansh.orchestrator.memory;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class ConversationTurn {

    String userInput;
    String agentResponse;

    @Builder.Default
    Map<String, Object> metadata = Map.of();

    @Builder.Default
    Instant timestamp = Instant.now();
}
