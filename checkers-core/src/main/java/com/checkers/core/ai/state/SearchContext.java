package com.checkers.core.ai.state;

import com.checkers.core.ai.SearchStatistics;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-call search bookkeeping: counters and the abort condition. A context is owned by one search
 * call; the root-parallel searcher shares it between its tasks, hence the atomic fields.
 */
public final class SearchContext {

    private final long deadlineNanos;
    private final long nodeBudget;
    private final long startNanos;
    private final AtomicLong nodes = new AtomicLong();
    private final AtomicLong cutoffs = new AtomicLong();
    private final AtomicLong leafEvaluations = new AtomicLong();
    private final AtomicInteger maxPly = new AtomicInteger();
    private final AtomicBoolean aborted = new AtomicBoolean();

    /**
     * @param deadlineNanos {@link System#nanoTime()} value after which the search aborts, or
     *                      {@link Long#MAX_VALUE} for none
     * @param nodeBudget    maximum number of nodes to visit, {@code 0} for none
     */
    public SearchContext(long deadlineNanos, long nodeBudget) {
        this.deadlineNanos = deadlineNanos;
        this.nodeBudget = nodeBudget;
        this.startNanos = System.nanoTime();
    }

    public static SearchContext unbounded() {
        return new SearchContext(Long.MAX_VALUE, 0L);
    }

    /**
     * Records entry into a node at {@code ply} and reports whether the search must stop before
     * expanding it.
     */
    public boolean enterNode(int ply) {
        if (aborted.get()) {
            return false;
        }
        if ((nodeBudget > 0L && nodes.get() >= nodeBudget)
                || (deadlineNanos != Long.MAX_VALUE && System.nanoTime() >= deadlineNanos)) {
            aborted.set(true);
            return false;
        }
        nodes.incrementAndGet();
        maxPly.accumulateAndGet(ply, Math::max);
        return true;
    }

    public void recordCutoff() {
        cutoffs.incrementAndGet();
    }

    public void recordLeafEvaluation() {
        leafEvaluations.incrementAndGet();
    }

    public boolean isAborted() {
        return aborted.get();
    }

    public long nodes() {
        return nodes.get();
    }

    public long cutoffs() {
        return cutoffs.get();
    }

    public long leafEvaluations() {
        return leafEvaluations.get();
    }

    public int maxPly() {
        return maxPly.get();
    }

    /**
     * Snapshots the counters into an iteration record for {@code depth}.
     */
    public SearchStatistics.Iteration toIteration(int depth) {
        return new SearchStatistics.Iteration(depth, nodes(), cutoffs(), leafEvaluations(), maxPly(), !isAborted(),
                System.nanoTime() - startNanos);
    }
}
