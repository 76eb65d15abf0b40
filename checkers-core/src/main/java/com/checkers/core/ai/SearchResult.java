package com.checkers.core.ai;

import com.checkers.core.Move;

/**
 * Result payload returned by {@link Searcher} implementations.
 *
 * @param move           the chosen move
 * @param score          the backed-up value of {@code move} from the mover's perspective
 * @param depthEvaluated the depth of the iteration that produced {@code move}
 * @param timedOut       whether a time limit or node budget cut the search short
 * @param statistics     counters collected during the search
 */
public record SearchResult(Move move, int score, int depthEvaluated, boolean timedOut,
        SearchStatistics statistics) {

    public SearchResult {
        statistics = statistics == null ? SearchStatistics.empty() : statistics;
    }

    public long visitedNodes() {
        return statistics.totalNodes();
    }
}
