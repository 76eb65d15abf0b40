package com.checkers.core.ai;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable search configuration passed to {@link Searcher} implementations.
 *
 * @param depthLimit maximum search depth in plies
 * @param timeLimit  wall-clock budget, {@link Duration#ZERO} for none
 * @param nodeBudget maximum number of visited nodes, {@code 0} for none
 * @param mode       sequential or root-parallel execution
 */
public record SearchConstraints(int depthLimit, Duration timeLimit, long nodeBudget, SearchMode mode) {

    public SearchConstraints {
        Objects.requireNonNull(timeLimit, "timeLimit");
        Objects.requireNonNull(mode, "mode");
        if (depthLimit < 1) {
            throw new IllegalArgumentException("depthLimit must be at least 1");
        }
        if (timeLimit.isNegative()) {
            throw new IllegalArgumentException("timeLimit must not be negative");
        }
        if (nodeBudget < 0L) {
            throw new IllegalArgumentException("nodeBudget must not be negative");
        }
    }

    public SearchConstraints(int depthLimit, Duration timeLimit, SearchMode mode) {
        this(depthLimit, timeLimit, 0L, mode);
    }

    /**
     * Depth-only constraints: no time limit, no node budget, sequential.
     */
    public static SearchConstraints depth(int depthLimit) {
        return new SearchConstraints(depthLimit, Duration.ZERO, 0L, SearchMode.SEQ);
    }

    /**
     * Returns {@code true} if the search may be cut short by a time limit or node budget.
     */
    public boolean isBudgeted() {
        return !timeLimit.isZero() || nodeBudget > 0L;
    }

    /**
     * Execution strategy hint for {@link Searcher} implementations.
     */
    public enum SearchMode {
        SEQ,
        PAR
    }
}
