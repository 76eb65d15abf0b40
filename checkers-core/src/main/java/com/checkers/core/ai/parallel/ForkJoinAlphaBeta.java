package com.checkers.core.ai.parallel;

import com.checkers.core.Board;
import com.checkers.core.Move;
import com.checkers.core.ai.MoveOrdering;
import com.checkers.core.ai.Negamax;
import com.checkers.core.ai.NoLegalMoveException;
import com.checkers.core.ai.SearchConstraints;
import com.checkers.core.ai.SearchResult;
import com.checkers.core.ai.SearchStatistics;
import com.checkers.core.ai.Searcher;
import com.checkers.core.ai.state.SearchContext;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.concurrent.RecursiveTask;

/**
 * Root-parallel searcher: every root move is searched as its own fork-join task on its own board
 * with a full window, and the results are combined in move-ordering order. Because each child value
 * is exact, the chosen move and value equal those of the sequential search.
 */
public final class ForkJoinAlphaBeta implements Searcher {

    private final Negamax negamax;
    private final ForkJoinPool pool;

    public ForkJoinAlphaBeta(Negamax negamax) {
        this(negamax, Runtime.getRuntime().availableProcessors());
    }

    public ForkJoinAlphaBeta(Negamax negamax, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        this.negamax = Objects.requireNonNull(negamax, "negamax");
        this.pool = new ForkJoinPool(parallelism);
    }

    public ForkJoinAlphaBeta(Negamax negamax, ForkJoinPool pool) {
        this.negamax = Objects.requireNonNull(negamax, "negamax");
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    /**
     * Shuts down the underlying {@link ForkJoinPool}.
     */
    public void shutdown() {
        pool.shutdown();
    }

    @Override
    public SearchResult search(Board board, SearchConstraints constraints) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(constraints, "constraints");

        long timeLimitNanos = constraints.timeLimit().isZero() ? 0L : Math.max(1L, constraints.timeLimit().toNanos());
        long deadline = timeLimitNanos == 0L ? Long.MAX_VALUE : deadlineAfter(timeLimitNanos);
        SearchContext context = new SearchContext(deadline, constraints.nodeBudget());

        int depth = constraints.depthLimit();
        Negamax.RootResult root = searchRoot(board, depth, context);
        Move move = root.move();
        int score = root.score();
        if (move == null) {
            move = MoveOrdering.order(board.legalMoves()).get(0);
            score = negamax.evaluator().evaluate(board.apply(move), board.sideToMove());
        }
        SearchStatistics statistics = new SearchStatistics(List.of(context.toIteration(depth)));
        return new SearchResult(move, score, depth, !root.completed(), statistics);
    }

    /**
     * Searches all root moves of {@code board} in parallel to {@code depth} plies.
     */
    public Negamax.RootResult searchRoot(Board board, int depth, SearchContext context) {
        List<Move> moves = MoveOrdering.order(board.legalMoves());
        if (moves.isEmpty()) {
            throw new NoLegalMoveException(board.sideToMove());
        }
        context.enterNode(0);
        return pool.invoke(new RootTask(board, moves, depth, context));
    }

    private static long deadlineAfter(long nanos) {
        long now = System.nanoTime();
        long result = now + nanos;
        return result < now ? Long.MAX_VALUE : result;
    }

    private final class RootTask extends RecursiveTask<Negamax.RootResult> {

        private final Board board;
        private final List<Move> moves;
        private final int depth;
        private final SearchContext context;

        RootTask(Board board, List<Move> moves, int depth, SearchContext context) {
            this.board = board;
            this.moves = moves;
            this.depth = depth;
            this.context = context;
        }

        @Override
        protected Negamax.RootResult compute() {
            List<ChildTask> children = new ArrayList<>(moves.size());
            for (Move move : moves) {
                children.add(new ChildTask(board.apply(move), depth - 1, context));
            }
            ForkJoinTask.invokeAll(children);

            Move bestMove = null;
            int bestScore = -Negamax.INFINITY;
            for (int i = 0; i < children.size(); i++) {
                ChildTask child = children.get(i);
                if (!child.completed) {
                    continue;
                }
                int score = -child.join();
                if (score > bestScore) {
                    bestScore = score;
                    bestMove = moves.get(i);
                }
            }
            return new Negamax.RootResult(bestMove, bestScore, !context.isAborted());
        }
    }

    private final class ChildTask extends RecursiveTask<Integer> {

        private final Board board;
        private final int depth;
        private final SearchContext context;
        private volatile boolean completed;

        ChildTask(Board board, int depth, SearchContext context) {
            this.board = board;
            this.depth = depth;
            this.context = context;
        }

        @Override
        protected Integer compute() {
            int score = negamax.search(board, depth, 1, -Negamax.INFINITY, Negamax.INFINITY, context);
            completed = !context.isAborted();
            return score;
        }
    }
}
