package com.deepansh.orchestrator.memory;

import com.deepansh.orchestrator.exception.NotFoundException;
import com.deepansh.orchestrator.model.Interaction;
import com.deepansh.orchestrator.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stores past episodes and recalls the most relevant ones for a new input.
 *
 * Relevance comes from a pluggable {@link SimilarityScorer}; episodes scoring 0
 * are never returned. Ties keep insertion order.
 */
@Slf4j
public class EpisodicMemory implements Memory {

    private final SimilarityScorer scorer;
    private final int recallLimit;

    private final Map<String, Episode> episodes = new LinkedHashMap<>();
    private final Map<String, Object> values = new ConcurrentHashMap<>();

    public EpisodicMemory() {
        this(new TokenOverlapScorer(), 3);
    }

    public EpisodicMemory(SimilarityScorer scorer, int recallLimit) {
        this.scorer = Objects.requireNonNull(scorer, "scorer");
        this.recallLimit = Math.max(0, recallLimit);
    }

    /**
     * Stores the episode under a freshly generated id, ignoring any id it carries.
     *
     * @return the assigned id
     */
    public String addEpisode(Episode episode) {
        Objects.requireNonNull(episode, "episode");
        String id = UUID.randomUUID().toString();
        synchronized (episodes) {
            episodes.put(id, episode.toBuilder()
                    .id(id)
                    .toolsUsed(episode.getToolsUsed() == null ? List.of() : List.copyOf(episode.getToolsUsed()))
                    .build());
        }
        log.debug("Episode stored: id={}", id);
        return id;
    }

    public List<Episode> searchEpisodes(String query, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<Episode> snapshot;
        synchronized (episodes) {
            snapshot = new ArrayList<>(episodes.values());
        }

        record Scored(Episode episode, double score) {}

        return snapshot.stream()
                .map(e -> new Scored(e, scorer.score(query, e)))
                .filter(s -> s.score() > 0.0)
                .sorted(Comparator.comparingDouble(Scored::score).reversed())
                .limit(limit)
                .map(Scored::episode)
                .toList();
    }

    public Episode getEpisode(String id) {
        synchronized (episodes) {
            Episode episode = episodes.get(id);
            if (episode == null) {
                throw new NotFoundException("Episode not found: " + id);
            }
            return episode;
        }
    }

    public int size() {
        synchronized (episodes) {
            return episodes.size();
        }
    }

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
        synchronized (episodes) {
            episodes.clear();
        }
        values.clear();
    }

    @Override
    public List<Message> contextFor(String input) {
        List<Message> context = new ArrayList<>();
        for (Episode episode : searchEpisodes(input, recallLimit)) {
            context.add(Message.agent(
                    "Relevant past episode: " + episode.getContent() + " -> " + episode.getOutcome(),
                    Map.of("source", "memory", "episodeId", episode.getId())));
        }
        return context;
    }

    @Override
    public void record(Interaction interaction) {
        addEpisode(Episode.builder()
                .content(interaction.getInput())
                .outcome(interaction.getOutput())
                .toolsUsed(interaction.getToolsUsed() == null ? List.of() : List.copyOf(interaction.getToolsUsed()))
                .build());
    }

    @Override
    public MemoryType type() {
        return MemoryType.EPISODIC;
    }
}
