package com.deepansh.orchestrator.memory;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fraction of distinct query tokens found in the episode's content and outcome.
 * Tokens are lowercased alphanumeric runs; one- and two-letter tokens are ignored.
 */
public final class TokenOverlapScorer implements SimilarityScorer {

    private static final int MIN_TOKEN_LENGTH = 3;

    @Override
    public double score(String query, Episode episode) {
        if (query == null || query.isBlank() || episode == null) return 0.0;

        Set<String> queryTokens = tokenize(query);
        if (queryTokens.isEmpty()) return 0.0;

        String text = (episode.getContent() == null ? "" : episode.getContent())
                + " " + (episode.getOutcome() == null ? "" : episode.getOutcome());
        Set<String> docTokens = tokenize(text);
        if (docTokens.isEmpty()) return 0.0;

        long hits = queryTokens.stream().filter(docTokens::contains).count();
        return (double) hits / queryTokens.size();
    }

    static Set<String> tokenize(String text) {
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(t -> t.length() >= MIN_TOKEN_LENGTH)
                .collect(Collectors.toSet());
    }
}
