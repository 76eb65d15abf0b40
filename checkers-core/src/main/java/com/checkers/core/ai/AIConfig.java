package com.checkers.core.ai;

import com.checkers.core.Settings;
import com.checkers.core.eval.EvaluationWeights;
import java.time.Duration;
import java.util.Objects;

/**
 * Construction-time configuration of {@link AlphaBetaAI}.
 *
 * @param depth      search depth in plies; each extra ply multiplies the work by the branching factor
 * @param timeLimit  wall-clock budget per search, {@link Duration#ZERO} for none
 * @param nodeBudget node budget per search, {@code 0} for none
 * @param mode       sequential or root-parallel execution
 * @param weights    evaluator weights
 */
public record AIConfig(int depth, Duration timeLimit, long nodeBudget, SearchConstraints.SearchMode mode,
        EvaluationWeights weights) {

    public static final int DEFAULT_DEPTH = 4;

    public AIConfig {
        Objects.requireNonNull(timeLimit, "timeLimit");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(weights, "weights");
        if (depth < 1) {
            throw new IllegalArgumentException("Depth must be at least 1");
        }
        if (timeLimit.isNegative()) {
            throw new IllegalArgumentException("timeLimit must not be negative");
        }
        if (nodeBudget < 0L) {
            throw new IllegalArgumentException("nodeBudget must not be negative");
        }
    }

    public static AIConfig ofDepth(int depth) {
        return new AIConfig(depth, Duration.ZERO, 0L, SearchConstraints.SearchMode.SEQ, EvaluationWeights.DEFAULT);
    }

    /**
     * Reads the configuration from system properties ({@code checkers.ai.depth},
     * {@code checkers.ai.timeLimitMillis}, {@code checkers.ai.nodeBudget}, {@code checkers.ai.mode},
     * {@code checkers.eval.kingValue}) or the matching {@code CHECKERS_*} environment variables.
     */
    public static AIConfig fromSystemProperties() {
        int depth = Settings.readInt("checkers.ai.depth", "CHECKERS_AI_DEPTH", DEFAULT_DEPTH);
        long timeLimitMillis = Settings.readLong("checkers.ai.timeLimitMillis", "CHECKERS_AI_TIME_LIMIT_MILLIS", 0L);
        long nodeBudget = Settings.readLong("checkers.ai.nodeBudget", "CHECKERS_AI_NODE_BUDGET", 0L);
        SearchConstraints.SearchMode mode = Settings.readEnum("checkers.ai.mode", "CHECKERS_AI_MODE",
                SearchConstraints.SearchMode.class, SearchConstraints.SearchMode.SEQ);
        int kingValue = Settings.readInt("checkers.eval.kingValue", "CHECKERS_EVAL_KING_VALUE",
                EvaluationWeights.DEFAULT.kingValue());
        return new AIConfig(depth, Duration.ofMillis(timeLimitMillis), nodeBudget, mode,
                EvaluationWeights.DEFAULT.withKingValue(kingValue));
    }

    public AIConfig withDepth(int value) {
        return new AIConfig(value, timeLimit, nodeBudget, mode, weights);
    }

    public AIConfig withTimeLimit(Duration value) {
        return new AIConfig(depth, value, nodeBudget, mode, weights);
    }

    public AIConfig withNodeBudget(long value) {
        return new AIConfig(depth, timeLimit, value, mode, weights);
    }

    public AIConfig withMode(SearchConstraints.SearchMode value) {
        return new AIConfig(depth, timeLimit, nodeBudget, value, weights);
    }

    public AIConfig withWeights(EvaluationWeights value) {
        return new AIConfig(depth, timeLimit, nodeBudget, mode, value);
    }

    public SearchConstraints toConstraints() {
        return new SearchConstraints(depth, timeLimit, nodeBudget, mode);
    }
}
