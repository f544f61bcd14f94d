package com.deepansh.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * What a finished run hands to memory: the exchange plus how it ended.
 */
@Value
@Builder
public class Interaction {

    String input;
    String output;
    String strategy;
    String outcome;

    @Builder.Default
    List<String> toolsUsed = List.of();
}
