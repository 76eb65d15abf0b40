package com.checkers.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.LongStream;
import java.util.stream.Stream;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.api.Test;

class MoveGeneratorTest {

    private static final String LONE_JUMP = String.join("\n",
            ". . . . . . . .",
            ". . . . . . . .",
            ". . . . . . . .",
            ". . . . . . . .",
            ". . . b . . . .",
            ". . r . . . . .",
            ". . . . . . . .",
            ". . . . . . . .") + "\n";

    private static final String BRANCHING = String.join("\n",
            ". . . . . . . .",
            ". . b . . . . .",
            ". . . . . . . .",
            ". . . . b . b .",
            ". . . . . . . .",
            ". . . . b . . .",
            ". . . r . . . .",
            ". . . . . . r .") + "\n";

    private static final String CROWNING = String.join("\n",
            ". . . . . . . .",
            ". . b . b . . .",
            ". r . . . . . .",
            ". . . . . . . .",
            ". . . . . . . .",
            ". . . . . . . .",
            ". . . . . . . .",
            ". . . . . . . .") + "\n";

    private static final String KING_LOOP = String.join("\n",
            ". . . . . . . .",
            ". . . . . . . .",
            ". . . . . . . .",
            ". . b . b . . .",
            ". . . . . . . .",
            ". . b . b . . .",
            ". . . R . . . .",
            ". . . . . . . .") + "\n";

    @Test
    void loneCaptureIsTheOnlyMove() {
        Board board = BoardDiagram.parse(LONE_JUMP, PieceColor.RED);

        List<Move> moves = board.legalMoves();

        assertEquals(List.of(Move.jump(Square.of(5, 2), List.of(Square.of(3, 4)), List.of(Square.of(4, 3)), false)),
                moves);
    }

    @Test
    void captureIsMandatoryAndEveryMaximalChainIsOffered() {
        Board board = BoardDiagram.parse(BRANCHING, PieceColor.RED);

        Set<Move> moves = new HashSet<>(board.legalMoves());

        Move longer = Move.jump(Square.of(6, 3), List.of(Square.of(4, 5), Square.of(2, 3), Square.of(0, 1)),
                List.of(Square.of(5, 4), Square.of(3, 4), Square.of(1, 2)), true);
        Move shorter = Move.jump(Square.of(6, 3), List.of(Square.of(4, 5), Square.of(2, 7)),
                List.of(Square.of(5, 4), Square.of(3, 6)), false);
        assertEquals(Set.of(longer, shorter), moves, "Both branches must be legal, not only the longest one");
    }

    @Test
    void menDoNotCaptureBackwards() {
        Board board = Board.empty(PieceColor.RED)
                .withPiece(Square.of(3, 2), Piece.man(PieceColor.RED))
                .withPiece(Square.of(4, 3), Piece.man(PieceColor.BLACK));

        List<Move> moves = board.legalMoves();

        assertEquals(2, moves.size());
        assertTrue(moves.stream().noneMatch(Move::isCapture));
    }

    @Test
    void crowningEndsTheMoveByDefault() {
        Board board = BoardDiagram.parse(CROWNING, PieceColor.RED);

        List<Move> moves = board.legalMoves();

        assertEquals(List.of(Move.jump(Square.of(2, 1), List.of(Square.of(0, 3)), List.of(Square.of(1, 2)), true)),
                moves);
        Board after = board.apply(moves.get(0));
        assertEquals(Piece.king(PieceColor.RED), after.pieceAt(Square.of(0, 3)).orElseThrow());
        assertTrue(after.pieceAt(Square.of(1, 4)).isPresent(), "The second man must survive");
    }

    @Test
    void crownedManCanContinueUnderTheAlternativeRule() {
        Board board = BoardDiagram.parse(CROWNING, PieceColor.RED, RuleSet.of(MidChainPromotion.CONTINUE_AS_KING));

        List<Move> moves = board.legalMoves();

        Move expected = Move.jump(Square.of(2, 1), List.of(Square.of(0, 3), Square.of(2, 5)),
                List.of(Square.of(1, 2), Square.of(1, 4)), true);
        assertEquals(List.of(expected), moves);
        Board after = board.apply(expected);
        assertEquals(Piece.king(PieceColor.RED), after.pieceAt(Square.of(2, 5)).orElseThrow());
        assertEquals(0, after.count(PieceColor.BLACK));
    }

    @Test
    void kingMayFinishOnItsOwnOriginButNeverJumpsAPieceTwice() {
        Board board = BoardDiagram.parse(KING_LOOP, PieceColor.RED);

        List<Move> moves = board.legalMoves();

        assertEquals(2, moves.size());
        for (Move move : moves) {
            assertEquals(4, move.jumpCount());
            assertEquals(move.origin(), move.destination());
            assertEquals(4, new HashSet<>(move.captured()).size());
        }
        Board after = board.apply(moves.get(0));
        assertEquals(Piece.king(PieceColor.RED), after.pieceAt(Square.of(6, 3)).orElseThrow());
        assertTrue(after.isTerminal(), "Black has nothing left");
    }

    @Test
    void blockedSideHasNoMoves() {
        Board board = Board.empty(PieceColor.RED)
                .withPiece(Square.of(7, 0), Piece.man(PieceColor.RED))
                .withPiece(Square.of(6, 1), Piece.man(PieceColor.BLACK))
                .withPiece(Square.of(5, 2), Piece.man(PieceColor.BLACK));

        assertTrue(board.legalMoves().isEmpty());
        assertTrue(board.isTerminal());
        assertFalse(board.withSideToMove(PieceColor.BLACK).isTerminal());
    }

    @ParameterizedTest
    @MethodSource("seeds")
    void matchesReferenceRulesOnPlayouts(long seed) {
        Random random = new Random(seed);
        Board board = Board.initial();
        for (int ply = 0; ply < 150 && !board.isTerminal(); ply++) {
            assertEquals(ReferenceRules.legalMoves(board), new HashSet<>(board.legalMoves()), board::toString);
            List<Move> moves = board.legalMoves();
            board = board.apply(moves.get(random.nextInt(moves.size())));
        }
    }

    @ParameterizedTest
    @MethodSource("seeds")
    void matchesReferenceRulesOnScatteredPositions(long seed) {
        Random random = new Random(seed);
        for (int i = 0; i < 20; i++) {
            RuleSet rules = random.nextBoolean() ? RuleSet.STANDARD : RuleSet.of(MidChainPromotion.CONTINUE_AS_KING);
            Board board = RandomBoards.scattered(random, rules);
            assertEquals(ReferenceRules.legalMoves(board), new HashSet<>(board.legalMoves()), board::toString);
        }
    }

    @ParameterizedTest
    @MethodSource("seeds")
    void noManEverRestsOnItsPromotionRow(long seed) {
        Random random = new Random(seed);
        Board board = Board.initial();
        for (int ply = 0; ply < 200 && !board.isTerminal(); ply++) {
            List<Move> moves = board.legalMoves();
            Move move = moves.get(random.nextInt(moves.size()));
            int before = board.count(PieceColor.RED) + board.count(PieceColor.BLACK);
            board = board.apply(move);
            assertEquals(before - move.captured().size(),
                    board.count(PieceColor.RED) + board.count(PieceColor.BLACK));
            for (PieceColor color : PieceColor.values()) {
                for (Square square : board.occupiedSquares(color)) {
                    Piece piece = board.pieceAt(square).orElseThrow();
                    assertFalse(piece.isMan() && square.row() == color.promotionRow(),
                            () -> "Uncrowned man on " + square);
                }
            }
        }
    }

    static Stream<Long> seeds() {
        return LongStream.rangeClosed(1, 12).boxed();
    }
}
