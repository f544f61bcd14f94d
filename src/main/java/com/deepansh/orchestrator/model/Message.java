package com.deepansh.orchestrator.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.HashMap;
import java.util.Map;

/**
 * One entry of a conversation. Immutable: a state's history only ever grows,
 * earlier entries are never rewritten.
 */
@Value
@Builder
@Jacksonized
public class Message {

    public enum Role {
        user, agent, tool
    }

    Role role;
    String content;

    /** Free-form annotations: producing step, tool name, memory source, ... */
    @Builder.Default
    Map<String, Object> metadata = Map.of();

    public static Message user(String content) {
        return Message.builder().role(Role.user).content(content).build();
    }

    public static Message agent(String content, Map<String, Object> metadata) {
        return Message.builder().role(Role.agent).content(content).metadata(Map.copyOf(metadata)).build();
    }

    public static Message tool(String toolName, String content, Map<String, Object> metadata) {
        Map<String, Object> meta = new HashMap<>(metadata);
        meta.put("tool", toolName);
        return Message.builder().role(Role.tool).content(content).metadata(Map.copyOf(meta)).build();
    }
}
