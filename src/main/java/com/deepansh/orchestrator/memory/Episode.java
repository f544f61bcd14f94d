package com.deepansh.orchestrator.memory;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A remembered task: what was asked, what came of it, which tools were used.
 * The id is assigned by {@link EpisodicMemory#addEpisode(Episode)}.
 */
@Value
@Builder(toBuilder = true)
public class Episode {

    String id;

    String content;
    String outcome;

    @Builder.Default
    List<String> toolsUsed = List.of();

    @Builder.Default
    Instant timestamp = Instant.now();
}
