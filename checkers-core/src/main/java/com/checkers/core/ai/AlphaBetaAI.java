package com.checkers.core.ai;

import com.checkers.core.Board;
import com.checkers.core.InvalidStateException;
import com.checkers.core.Move;
import com.checkers.core.PieceColor;
import com.checkers.core.ai.parallel.ForkJoinAlphaBeta;
import com.checkers.core.ai.state.SearchContext;
import com.checkers.core.eval.Evaluator;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Negamax searcher with alpha-beta pruning and optional time and node budgets.
 *
 * <p>Without a budget the requested depth is searched directly. With a budget the search deepens
 * iteratively from depth 1 and returns the result of the deepest iteration that completed.
 */
public final class AlphaBetaAI implements Searcher {

    private static final Logger LOGGER = Logger.getLogger(AlphaBetaAI.class.getName());

    private final AIConfig config;
    private final Negamax negamax;
    private ForkJoinAlphaBeta parallelSearcher;

    private SearchResult lastResult;

    public AlphaBetaAI(int depth) {
        this(AIConfig.ofDepth(depth));
    }

    public AlphaBetaAI(int depth, Duration timeLimit) {
        this(AIConfig.ofDepth(depth).withTimeLimit(timeLimit));
    }

    public AlphaBetaAI(AIConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.negamax = new Negamax(new Evaluator(config.weights()), true);
    }

    public AIConfig getConfig() {
        return config;
    }

    public int getDepth() {
        return config.depth();
    }

    public Evaluator getEvaluator() {
        return negamax.evaluator();
    }

    /**
     * Returns the best move for {@code player} on {@code board} at the configured depth.
     *
     * @throws InvalidStateException if {@code player} is not the side to move
     * @throws NoLegalMoveException  if {@code player} has no legal move
     */
    public Move getBestMove(Board board, PieceColor player) {
        return searchBestMove(board, player).move();
    }

    /**
     * Like {@link #getBestMove(Board, PieceColor)}, returning the value and search statistics as well.
     */
    public SearchResult searchBestMove(Board board, PieceColor player) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(player, "player");
        if (player != board.sideToMove()) {
            throw new InvalidStateException("Cannot search for " + player + ": " + board.sideToMove() + " is to move");
        }
        return search(board, config.toConstraints());
    }

    public long getLastVisitedNodeCount() {
        return lastResult == null ? 0L : lastResult.visitedNodes();
    }

    public boolean wasLastSearchTimedOut() {
        return lastResult != null && lastResult.timedOut();
    }

    public SearchResult getLastResult() {
        return lastResult;
    }

    @Override
    public SearchResult search(Board board, SearchConstraints constraints) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(constraints, "constraints");
        if (board.isTerminal()) {
            throw new NoLegalMoveException(board.sideToMove());
        }

        int boundedDepth = Math.min(config.depth(), constraints.depthLimit());
        long timeLimitNanos = toTimeLimitNanos(constraints.timeLimit());
        long deadlineNanos = timeLimitNanos == Long.MAX_VALUE
                ? Long.MAX_VALUE
                : saturatingAdd(System.nanoTime(), timeLimitNanos);

        SearchResult result;
        if (constraints.isBudgeted()) {
            result = iterativeDeepening(board, boundedDepth, deadlineNanos, constraints.nodeBudget(),
                    constraints.mode());
        } else {
            IterationResult iteration = runIteration(board, boundedDepth, Long.MAX_VALUE, 0L, constraints.mode());
            result = new SearchResult(iteration.root.move(), iteration.root.score(), boundedDepth, false,
                    new SearchStatistics(List.of(iteration.statistics)));
        }

        SearchStatistics statistics = result.statistics();
        LOGGER.info(() -> String.format("Alpha-beta explored %d nodes, %d cutoffs (depth=%d, mode=%s, score=%d, move=%s)",
                statistics.totalNodes(), statistics.totalCutoffs(), result.depthEvaluated(), constraints.mode(),
                result.score(), result.move()));
        lastResult = result;
        return result;
    }

    /**
     * Scores every legal move of the side to move, searching each reply to the configured depth
     * minus one, best first. Equal scores keep move-ordering order.
     */
    public List<ScoredMove> scoreMoves(Board board) {
        Objects.requireNonNull(board, "board");
        int replyDepth = Math.max(0, config.depth() - 1);
        List<ScoredMove> scored = new ArrayList<>();
        for (Move move : MoveOrdering.order(board.legalMoves())) {
            SearchContext context = SearchContext.unbounded();
            int score = -negamax.search(board.apply(move), replyDepth, 1, -Negamax.INFINITY, Negamax.INFINITY,
                    context);
            scored.add(new ScoredMove(move, score));
        }
        scored.sort(Comparator.comparingInt(ScoredMove::score).reversed());
        return scored;
    }

    private SearchResult iterativeDeepening(Board board, int depthLimit, long deadlineNanos, long nodeBudget,
            SearchConstraints.SearchMode mode) {
        List<SearchStatistics.Iteration> iterations = new ArrayList<>();
        IterationResult lastComplete = null;
        IterationResult lastAttempt = null;
        long totalVisited = 0L;
        boolean timedOut = false;

        for (int depth = 1; depth <= depthLimit; depth++) {
            long remainingBudget = 0L;
            if (nodeBudget > 0L) {
                remainingBudget = nodeBudget - totalVisited;
                if (remainingBudget <= 0L) {
                    timedOut = true;
                    break;
                }
            }

            IterationResult iteration = runIteration(board, depth, deadlineNanos, remainingBudget, mode);
            iterations.add(iteration.statistics);
            totalVisited += iteration.statistics.nodes();
            lastAttempt = iteration;
            LOGGER.fine(() -> String.format("Depth %d: %d nodes, completed=%b", iteration.depth,
                    iteration.statistics.nodes(), iteration.root.completed()));

            if (!iteration.root.completed()) {
                timedOut = true;
                break;
            }
            lastComplete = iteration;
        }

        Move move;
        int score;
        int depthEvaluated;
        if (lastComplete != null) {
            move = lastComplete.root.move();
            score = lastComplete.root.score();
            depthEvaluated = lastComplete.depth;
        } else if (lastAttempt != null && lastAttempt.root.move() != null) {
            move = lastAttempt.root.move();
            score = lastAttempt.root.score();
            depthEvaluated = lastAttempt.depth;
        } else {
            move = MoveOrdering.order(board.legalMoves()).get(0);
            score = negamax.evaluator().evaluate(board.apply(move), board.sideToMove());
            depthEvaluated = 0;
            LOGGER.log(Level.WARNING, "Search budget exhausted before any move was searched; playing {0}", move);
        }
        return new SearchResult(move, score, depthEvaluated, timedOut, new SearchStatistics(iterations));
    }

    private IterationResult runIteration(Board board, int depth, long deadlineNanos, long nodeBudget,
            SearchConstraints.SearchMode mode) {
        SearchContext context = new SearchContext(deadlineNanos, nodeBudget);
        Negamax.RootResult root = mode == SearchConstraints.SearchMode.PAR
                ? getParallelSearcher().searchRoot(board, depth, context)
                : negamax.searchRoot(board, depth, context);
        return new IterationResult(root, depth, context.toIteration(depth));
    }

    private ForkJoinAlphaBeta getParallelSearcher() {
        if (parallelSearcher == null) {
            parallelSearcher = new ForkJoinAlphaBeta(negamax);
        }
        return parallelSearcher;
    }

    private long toTimeLimitNanos(Duration timeLimit) {
        long nanos = timeLimit.isZero() ? Long.MAX_VALUE : timeLimit.toNanos();
        return nanos <= 0L ? 1L : nanos;
    }

    private long saturatingAdd(long a, long b) {
        long result = a + b;
        if (((a ^ result) & (b ^ result)) < 0) {
            return Long.MAX_VALUE;
        }
        return result;
    }

    private record IterationResult(Negamax.RootResult root, int depth, SearchStatistics.Iteration statistics) {
    }
}
