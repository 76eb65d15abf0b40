package com.checkers.core.ai;

import com.checkers.core.Board;
import com.checkers.core.InvalidStateException;
import com.checkers.core.Move;
import com.checkers.core.PieceColor;
import com.checkers.core.ai.state.SearchContext;
import com.checkers.core.eval.Evaluator;
import java.util.List;
import java.util.Objects;

/**
 * Plain minimax without pruning. It shares move ordering, terminal scoring and tie-breaking with
 * {@link AlphaBetaAI}, so both must agree on the chosen move and its value at any fixed depth.
 * Time limits, node budgets and the search mode are ignored: every search runs to completion.
 */
public final class MinimaxAI implements Searcher {

    private final int depth;
    private final Negamax negamax;

    public MinimaxAI(int depth) {
        this(depth, new Evaluator());
    }

    public MinimaxAI(int depth, Evaluator evaluator) {
        if (depth < 1) {
            throw new IllegalArgumentException("Depth must be at least 1");
        }
        this.depth = depth;
        this.negamax = new Negamax(evaluator, false);
    }

    public Move getBestMove(Board board, PieceColor player) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(player, "player");
        if (player != board.sideToMove()) {
            throw new InvalidStateException("Cannot search for " + player + ": " + board.sideToMove() + " is to move");
        }
        return search(board, SearchConstraints.depth(depth)).move();
    }

    @Override
    public SearchResult search(Board board, SearchConstraints constraints) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(constraints, "constraints");
        if (board.isTerminal()) {
            throw new NoLegalMoveException(board.sideToMove());
        }

        int searchDepth = constraints.depthLimit();
        SearchContext context = SearchContext.unbounded();
        Negamax.RootResult root = negamax.searchRoot(board, searchDepth, context);
        SearchStatistics statistics = new SearchStatistics(List.of(context.toIteration(searchDepth)));
        return new SearchResult(root.move(), root.score(), searchDepth, false, statistics);
    }
}
