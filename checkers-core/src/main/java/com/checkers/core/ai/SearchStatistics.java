package com.checkers.core.ai;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregated instrumentation data captured during a single {@link Searcher#search} call. One
 * {@link Iteration} is recorded per depth searched.
 */
public final class SearchStatistics {

    private static final SearchStatistics EMPTY = new SearchStatistics(List.of());

    private final List<Iteration> iterations;

    public SearchStatistics(List<Iteration> iterations) {
        if (iterations == null || iterations.isEmpty()) {
            this.iterations = List.of();
        } else {
            this.iterations = Collections.unmodifiableList(new ArrayList<>(iterations));
        }
    }

    public static SearchStatistics empty() {
        return EMPTY;
    }

    public List<Iteration> iterations() {
        return iterations;
    }

    public long totalNodes() {
        return iterations.stream().mapToLong(Iteration::nodes).sum();
    }

    public long totalCutoffs() {
        return iterations.stream().mapToLong(Iteration::cutoffs).sum();
    }

    public long totalLeafEvaluations() {
        return iterations.stream().mapToLong(Iteration::leafEvaluations).sum();
    }

    public int maxDepthReached() {
        return iterations.stream().mapToInt(Iteration::maxDepthReached).max().orElse(0);
    }

    /**
     * Cutoffs per visited node.
     */
    public double pruningRatio() {
        return totalCutoffs() / (double) Math.max(1L, totalNodes());
    }

    public record Iteration(
            int depth,
            long nodes,
            long cutoffs,
            long leafEvaluations,
            int maxDepthReached,
            boolean completed,
            long elapsedNanos) {
    }
}
