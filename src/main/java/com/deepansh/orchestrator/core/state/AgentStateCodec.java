package com.deepansh.orchestrator.core.state;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Converts states to a structured record (field name to value) and back.
 * The record carries a "strategy" discriminator, so a resumed run picks the right
 * state type. Wire encoding of the record is left to whoever stores it.
 */
@Slf4j
public class AgentStateCodec {

    private final ObjectMapper objectMapper;

    public AgentStateCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> toRecord(AgentState state) {
        return objectMapper.convertValue(state, new TypeReference<>() {});
    }

    public AgentState fromRecord(Map<String, Object> record) {
        AgentState state;
        try {
            state = objectMapper.convertValue(record, AgentState.class);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Not a valid agent state record: " + e.getMessage(), e);
        }
        state.checkInvariants();
        log.debug("Restored {} state at step {}", state.getStrategy(), state.getCurrentStep());
        return state;
    }
}
