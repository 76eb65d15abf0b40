package com.checkers.core.analysis;

import com.checkers.core.Move;
import com.checkers.core.PieceColor;
import com.checkers.core.ai.ScoredMove;
import java.util.List;
import java.util.Objects;

/**
 * Verdict on one played move. Scores are from the mover's perspective.
 *
 * @param moveNumber      1-based ply number of the move in the match
 * @param player          the side that played the move
 * @param move            the move played
 * @param classification  quality grade
 * @param scoreDifference value lost against the best move, never negative
 * @param bestScore       value of the best move
 * @param actualScore     value of the move played
 * @param description     human-readable summary
 * @param topMoves        the highest scored alternatives, best first
 */
public record MoveAnalysis(
        int moveNumber,
        PieceColor player,
        Move move,
        MoveClassification classification,
        int scoreDifference,
        int bestScore,
        int actualScore,
        String description,
        List<ScoredMove> topMoves) {

    public MoveAnalysis {
        Objects.requireNonNull(player, "player");
        Objects.requireNonNull(move, "move");
        Objects.requireNonNull(classification, "classification");
        Objects.requireNonNull(description, "description");
        topMoves = List.copyOf(topMoves);
        if (scoreDifference < 0) {
            throw new IllegalArgumentException("scoreDifference must not be negative");
        }
    }
}
