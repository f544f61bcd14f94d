package com.deepansh.orchestrator.core;

import com.deepansh.orchestrator.core.state.AgentState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The fixed set of steps a machine may run and the transitions allowed between them.
 * {@link AgentState#TERMINATE} is always a node.
 */
public final class StepGraph {

    private final String start;
    private final Map<String, Set<String>> edges;

    private StepGraph(String start, Map<String, Set<String>> edges) {
        this.start = start;
        this.edges = edges;
    }

    public static Builder startingAt(String start) {
        return new Builder(start);
    }

    public String getStart() {
        return start;
    }

    public Set<String> getNodes() {
        return Collections.unmodifiableSet(edges.keySet());
    }

    public Map<String, Set<String>> getEdges() {
        return Collections.unmodifiableMap(edges);
    }

    public Set<String> successors(String node) {
        return edges.getOrDefault(node, Set.of());
    }

    public boolean hasNode(String node) {
        return edges.containsKey(node);
    }

    public boolean allows(String from, String to) {
        return successors(from).contains(to);
    }

    /**
     * One line per step: {@code REFLECT -> REFINE}.
     */
    public String describe() {
        return edges.entrySet().stream()
                .filter(e -> !e.getValue().isEmpty())
                .map(e -> e.getKey() + " -> " + String.join(" | ", e.getValue()))
                .collect(Collectors.joining("\n"));
    }

    @Override
    public String toString() {
        return describe();
    }

    public static final class Builder {

        private final String start;
        private final Map<String, Set<String>> edges = new LinkedHashMap<>();

        private Builder(String start) {
            this.start = start;
            edges.put(start, new LinkedHashSet<>());
        }

        public Builder edge(String from, String... to) {
            edges.computeIfAbsent(from, k -> new LinkedHashSet<>()).addAll(List.of(to));
            for (String target : to) {
                edges.computeIfAbsent(target, k -> new LinkedHashSet<>());
            }
            return this;
        }

        public StepGraph build() {
            edges.computeIfAbsent(AgentState.TERMINATE, k -> new LinkedHashSet<>());
            Map<String, Set<String>> frozen = new LinkedHashMap<>();
            edges.forEach((k, v) -> frozen.put(k, Collections.unmodifiableSet(new LinkedHashSet<>(v))));
            return new StepGraph(start, Collections.unmodifiableMap(frozen));
        }
    }
}
