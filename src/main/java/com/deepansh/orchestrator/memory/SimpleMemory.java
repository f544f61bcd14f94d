package com.deepansh.orchestrator.memory;

import com.deepansh.orchestrator.model.Interaction;
import com.deepansh.orchestrator.model.Message;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Plain key/value store. Recording an interaction keeps only the latest
 * exchange, which is replayed as context for the next run.
 */
public class SimpleMemory implements Memory {

    static final String LAST_INPUT_KEY = "last_input";
    static final String LAST_OUTPUT_KEY = "last_output";

    private final Map<String, Object> values = new ConcurrentHashMap<>();

    @Override
    public void store(String key, Object value) {
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
    }

    @Override
    public Optional<Object> retrieve(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void clear() {
        values.clear();
    }

    @Override
    public synchronized List<Message> contextFor(String input) {
        Object lastInput = values.get(LAST_INPUT_KEY);
        Object lastOutput = values.get(LAST_OUTPUT_KEY);
        if (lastInput == null || lastOutput == null) {
            return List.of();
        }
        Map<String, Object> meta = Map.of("source", "memory");
        return List.of(
                Message.builder().role(Message.Role.user).content(lastInput.toString()).metadata(meta).build(),
                Message.agent(lastOutput.toString(), meta)
        );
    }

    @Override
    public synchronized void record(Interaction interaction) {
        store(LAST_INPUT_KEY, interaction.getInput());
        store(LAST_OUTPUT_KEY, interaction.getOutput());
    }

    @Override
    public MemoryType type() {
        return MemoryType.SIMPLE;
    }
}
