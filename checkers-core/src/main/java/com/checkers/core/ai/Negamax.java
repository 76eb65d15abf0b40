package com.checkers.core.ai;

import com.checkers.core.Board;
import com.checkers.core.Move;
import com.checkers.core.ai.state.SearchContext;
import com.checkers.core.eval.Evaluator;
import java.util.List;
import java.util.Objects;

/**
 * Depth-limited negamax over immutable boards, with or without alpha-beta pruning. Scores are always
 * relative to the side to move at the node being scored.
 */
public final class Negamax {

    /** Magnitude of a won position; far beyond any static evaluation. */
    public static final int WIN_SCORE = 1_000_000;
    public static final int INFINITY = Integer.MAX_VALUE / 2;

    private final Evaluator evaluator;
    private final boolean pruning;

    public Negamax(Evaluator evaluator, boolean pruning) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.pruning = pruning;
    }

    public Evaluator evaluator() {
        return evaluator;
    }

    /**
     * Returns the score for a side that has no legal move at {@code ply}: a loss, less severe the
     * later it happens so that faster wins are preferred.
     */
    public static int lossScore(int ply) {
        return -(WIN_SCORE - ply);
    }

    /**
     * Returns {@code true} if {@code score} denotes a forced win or loss rather than a heuristic
     * evaluation.
     */
    public static boolean isDecisive(int score) {
        return Math.abs(score) > WIN_SCORE / 2;
    }

    /**
     * Searches every root move in move-ordering order and keeps the first one achieving the best
     * value. Moves whose subtree was cut short by an abort are ignored.
     */
    public RootResult searchRoot(Board board, int depth, SearchContext context) {
        List<Move> moves = MoveOrdering.order(board.legalMoves());
        if (moves.isEmpty()) {
            throw new NoLegalMoveException(board.sideToMove());
        }
        context.enterNode(0);

        int alpha = -INFINITY;
        Move bestMove = null;
        int bestScore = -INFINITY;
        for (Move move : moves) {
            int score = -search(board.apply(move), depth - 1, 1, -INFINITY, -alpha, context);
            if (context.isAborted()) {
                break;
            }
            if (score > bestScore) {
                bestScore = score;
                bestMove = move;
            }
            if (pruning && score > alpha) {
                alpha = score;
            }
        }
        return new RootResult(bestMove, bestScore, !context.isAborted());
    }

    /**
     * Returns the negamax value of {@code board} searched to {@code depth} more plies within the
     * window ({@code alpha}, {@code beta}).
     */
    public int search(Board board, int depth, int ply, int alpha, int beta, SearchContext context) {
        if (!context.enterNode(ply)) {
            return 0;
        }

        List<Move> moves = board.legalMoves();
        if (moves.isEmpty()) {
            return lossScore(ply);
        }
        if (depth <= 0) {
            context.recordLeafEvaluation();
            return evaluator.evaluate(board, board.sideToMove());
        }

        int best = -INFINITY;
        for (Move move : MoveOrdering.order(moves)) {
            int score = -search(board.apply(move), depth - 1, ply + 1, -beta, -alpha, context);
            if (context.isAborted()) {
                return best;
            }
            if (score > best) {
                best = score;
            }
            if (pruning) {
                if (score > alpha) {
                    alpha = score;
                }
                if (alpha >= beta) {
                    context.recordCutoff();
                    break;
                }
            }
        }
        return best;
    }

    /**
     * Outcome of a root search.
     *
     * @param move      the best move found, {@code null} if the search aborted before any root move
     *                  was fully searched
     * @param score     the value of {@code move} from the mover's perspective
     * @param completed whether every root move was searched without an abort
     */
    public record RootResult(Move move, int score, boolean completed) {
    }
}
