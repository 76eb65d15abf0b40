package com.checkers.core.eval;

import com.checkers.core.Board;
import com.checkers.core.Piece;
import com.checkers.core.PieceColor;
import com.checkers.core.Square;
import java.util.Objects;

/**
 * Static position evaluator. Every term is computed for both colors and the score is the
 * difference, so {@code evaluate(board, RED) == -evaluate(board, BLACK)} for every board.
 */
public final class Evaluator {

    private static final int TERMS = 5;
    private static final int MATERIAL = 0;
    private static final int POSITIONAL = 1;
    private static final int ADVANCEMENT = 2;
    private static final int MOBILITY = 3;
    private static final int THREATS = 4;

    private final EvaluationWeights weights;

    public Evaluator() {
        this(EvaluationWeights.DEFAULT);
    }

    public Evaluator(EvaluationWeights weights) {
        this.weights = Objects.requireNonNull(weights, "weights");
    }

    public EvaluationWeights weights() {
        return weights;
    }

    /**
     * Scores {@code board} from the point of view of {@code perspective}; positive is good for it.
     */
    public int evaluate(Board board, PieceColor perspective) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(perspective, "perspective");
        int[] own = terms(board, perspective);
        int[] other = terms(board, perspective.opponent());
        int score = 0;
        for (int i = 0; i < TERMS; i++) {
            score += own[i] - other[i];
        }
        return score;
    }

    public EvaluationBreakdown breakdown(Board board, PieceColor perspective) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(perspective, "perspective");
        int[] own = terms(board, perspective);
        int[] other = terms(board, perspective.opponent());
        return new EvaluationBreakdown(
                own[MATERIAL] - other[MATERIAL],
                own[POSITIONAL] - other[POSITIONAL],
                own[ADVANCEMENT] - other[ADVANCEMENT],
                own[MOBILITY] - other[MOBILITY],
                own[THREATS] - other[THREATS]);
    }

    private int[] terms(Board board, PieceColor color) {
        int[] terms = new int[TERMS];
        for (Square square : board.occupiedSquares(color)) {
            Piece piece = board.pieceAt(square).orElseThrow();
            terms[MATERIAL] += piece.king() ? weights.kingValue() : weights.manValue();
            terms[POSITIONAL] += positional(square, piece);
            if (piece.isMan() && color.rowsToPromotion(square.row()) <= weights.advancementRows()) {
                terms[ADVANCEMENT] += weights.advancementBonus();
            }
        }
        if (weights.mobilityWeight() > 0) {
            terms[MOBILITY] = weights.mobilityWeight() * board.mobility(color);
        }
        if (weights.captureThreatWeight() > 0) {
            terms[THREATS] = weights.captureThreatWeight() * board.jumpOpportunities(color);
        }
        return terms;
    }

    private int positional(Square square, Piece piece) {
        int bonus = 0;
        if (square.row() >= 2 && square.row() <= 5 && square.col() >= 2 && square.col() <= 5) {
            bonus += weights.centerBonus();
        }
        if (square.col() == 0 || square.col() == Board.SIZE - 1) {
            bonus += weights.edgeBonus();
        }
        if (piece.isMan() && square.row() == piece.color().homeRow()) {
            bonus += weights.backRowBonus();
        }
        return bonus;
    }
}
