package com.deepansh.orchestrator.memory;

import com.deepansh.orchestrator.model.Interaction;
import com.deepansh.orchestrator.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded conversation window. Once maxHistory turns are held, each new turn
 * evicts the oldest one.
 */
@Slf4j
public class ConversationMemory implements Memory {

    private final int maxHistory;
    private final int contextTurns;

    private final Deque<ConversationTurn> turns = new ArrayDeque<>();
    private final Map<String, Object> values = new HashMap<>();

    public ConversationMemory() {
        this(100, 5);
    }

    public ConversationMemory(int maxHistory, int contextTurns) {
        if (maxHistory < 1) {
            throw new IllegalArgumentException("maxHistory must be at least 1, got " + maxHistory);
        }
        this.maxHistory = maxHistory;
        this.contextTurns = Math.max(0, contextTurns);
    }

    public synchronized void addConversationTurn(String userInput, String agentResponse, Map<String, Object> metadata) {
        turns.addLast(ConversationTurn.builder()
                .userInput(userInput)
                .agentResponse(agentResponse)
                .metadata(metadata == null ? Map.of() : Map.copyOf(metadata))
                .build());
        while (turns.size() > maxHistory) {
            turns.removeFirst();
        }
        log.debug("Conversation turn added ({} / {})", turns.size(), maxHistory);
    }

    /**
     * Last n turns, oldest first. Fewer when the history is shorter; empty for n <= 0.
     */
    public synchronized List<ConversationTurn> getRecentContext(int n) {
        if (n <= 0 || turns.isEmpty()) {
            return List.of();
        }
        List<ConversationTurn> all = new ArrayList<>(turns);
        return List.copyOf(all.subList(Math.max(0, all.size() - n), all.size()));
    }

    public synchronized int size() {
        return turns.size();
    }

    public int getMaxHistory() {
        return maxHistory;
    }

    @Override
    public synchronized void store(String key, Object value) {
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
    }

    @Override
    public synchronized Optional<Object> retrieve(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public synchronized void clear() {
        turns.clear();
        values.clear();
    }

    @Override
    public List<Message> contextFor(String input) {
        List<Message> context = new ArrayList<>();
        Map<String, Object> meta = Map.of("source", "memory");
        for (ConversationTurn turn : getRecentContext(contextTurns)) {
            context.add(Message.builder().role(Message.Role.user).content(turn.getUserInput()).metadata(meta).build());
            context.add(Message.agent(turn.getAgentResponse() == null ? "" : turn.getAgentResponse(), meta));
        }
        return context;
    }

    @Override
    public void record(Interaction interaction) {
        Map<String, Object> metadata = new HashMap<>();
        if (interaction.getStrategy() != null) {
            metadata.put("strategy", interaction.getStrategy());
        }
        if (interaction.getOutcome() != null) {
            metadata.put("outcome", interaction.getOutcome());
        }
        addConversationTurn(interaction.getInput(), interaction.getOutput(), metadata);
    }

    @Override
    public MemoryType type() {
        return MemoryType.CONVERSATION;
    }
}
