package com.checkers.core.eval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.checkers.core.Board;
import com.checkers.core.Piece;
import com.checkers.core.PieceColor;
import com.checkers.core.RandomBoards;
import com.checkers.core.RuleSet;
import com.checkers.core.Square;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class EvaluatorTest {

    private final Evaluator evaluator = new Evaluator();

    @Test
    void openingIsBalanced() {
        assertEquals(0, evaluator.evaluate(Board.initial(), PieceColor.RED));
        assertEquals(0, evaluator.evaluate(Board.initial(), PieceColor.BLACK));
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 2L, 3L, 4L, 5L})
    void scoreFlipsSignWithPerspective(long seed) {
        Random random = new Random(seed);
        for (int i = 0; i < 20; i++) {
            Board board = i % 2 == 0
                    ? RandomBoards.playout(random, random.nextInt(60))
                    : RandomBoards.scattered(random, RuleSet.STANDARD);

            assertEquals(-evaluator.evaluate(board, PieceColor.BLACK), evaluator.evaluate(board, PieceColor.RED),
                    board::toString);
        }
    }

    @Test
    void kingsAreWorthMoreThanMen() {
        Evaluator materialOnly = new Evaluator(EvaluationWeights.MATERIAL_ONLY);
        Board board = Board.empty(PieceColor.RED)
                .withPiece(Square.of(7, 0), Piece.king(PieceColor.RED))
                .withPiece(Square.of(6, 3), Piece.man(PieceColor.RED))
                .withPiece(Square.of(0, 7), Piece.man(PieceColor.BLACK));

        assertEquals(300, materialOnly.evaluate(board, PieceColor.RED));
        assertEquals(-300, materialOnly.evaluate(board, PieceColor.BLACK));
        assertEquals(200, new Evaluator(EvaluationWeights.MATERIAL_ONLY.withKingValue(200))
                .evaluate(board, PieceColor.RED));
    }

    @Test
    void breakdownAddsUpToTheScore() {
        Random random = new Random(42L);
        for (int i = 0; i < 10; i++) {
            Board board = RandomBoards.playout(random, 30);

            EvaluationBreakdown breakdown = evaluator.breakdown(board, PieceColor.RED);

            assertEquals(evaluator.evaluate(board, PieceColor.RED), breakdown.total());
        }
    }

    @Test
    void menNearPromotionEarnTheAdvancementBonus() {
        Board near = Board.empty(PieceColor.BLACK).withPiece(Square.of(1, 2), Piece.man(PieceColor.RED));
        Board far = Board.empty(PieceColor.BLACK).withPiece(Square.of(4, 1), Piece.man(PieceColor.RED));

        assertEquals(EvaluationWeights.DEFAULT.advancementBonus(),
                evaluator.breakdown(near, PieceColor.RED).advancement());
        assertEquals(0, evaluator.breakdown(far, PieceColor.RED).advancement());
    }

    @Test
    void threatsCountAvailableJumps() {
        Board board = Board.empty(PieceColor.RED)
                .withPiece(Square.of(5, 2), Piece.man(PieceColor.RED))
                .withPiece(Square.of(6, 1), Piece.man(PieceColor.RED))
                .withPiece(Square.of(4, 3), Piece.man(PieceColor.BLACK))
                .withPiece(Square.of(0, 7), Piece.man(PieceColor.BLACK));

        EvaluationBreakdown breakdown = evaluator.breakdown(board, PieceColor.RED);

        assertEquals(EvaluationWeights.DEFAULT.captureThreatWeight(), breakdown.threats());
    }

    @Test
    void rejectsInconsistentWeights() {
        assertThrows(IllegalArgumentException.class, () -> EvaluationWeights.DEFAULT.withKingValue(50));
        assertThrows(IllegalArgumentException.class, () -> EvaluationWeights.DEFAULT.withMobilityWeight(-1));
    }
}
