package com.deepansh.orchestrator.memory;

/**
 * Relevance of an episode to a query. Higher is more relevant; 0 means unrelated.
 */
@FunctionalInterface
public interface SimilarityScorer {

    double score(String query, Episode episode);
}
