package com.checkers.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class MoveNotationTest {

    @Test
    void formatsSquaresWithFilesAndRanks() {
        assertEquals("c3", MoveNotation.formatSquare(Square.of(5, 2)));
        assertEquals("b8", MoveNotation.formatSquare(Square.of(0, 1)));
        assertEquals(Square.of(7, 0), MoveNotation.parseSquare("A1"));
        assertThrows(IllegalArgumentException.class, () -> MoveNotation.parseSquare("i9"));
    }

    @Test
    void formatsStepsAndChains() {
        assertEquals("c3-d4", Move.step(Square.of(5, 2), Square.of(4, 3), false).toString());
        Move chain = Move.jump(Square.of(6, 3), List.of(Square.of(4, 5), Square.of(2, 7)),
                List.of(Square.of(5, 4), Square.of(3, 6)), false);
        assertEquals("d2xf4xh6", MoveNotation.format(chain));
    }

    @Test
    void parsesFullPathsAndEndpoints() {
        Board board = Board.empty(PieceColor.RED)
                .withPiece(Square.of(6, 3), Piece.man(PieceColor.RED))
                .withPiece(Square.of(5, 4), Piece.man(PieceColor.BLACK))
                .withPiece(Square.of(3, 6), Piece.man(PieceColor.BLACK));

        Move full = MoveNotation.parse("d2xf4xh6", board);
        Move shortened = MoveNotation.parse("d2:h6", board);

        assertEquals(full, shortened);
        assertEquals(2, full.jumpCount());
    }

    @Test
    void rejectsIllegalAndAmbiguousInput() {
        Board loop = Board.empty(PieceColor.RED)
                .withPiece(Square.of(6, 3), Piece.king(PieceColor.RED))
                .withPiece(Square.of(5, 2), Piece.man(PieceColor.BLACK))
                .withPiece(Square.of(5, 4), Piece.man(PieceColor.BLACK))
                .withPiece(Square.of(3, 2), Piece.man(PieceColor.BLACK))
                .withPiece(Square.of(3, 4), Piece.man(PieceColor.BLACK));

        assertThrows(InvalidMoveException.class, () -> MoveNotation.parse("d2xd2", loop));
        assertThrows(InvalidMoveException.class, () -> MoveNotation.parse("c3-d5", Board.initial()));
        assertThrows(InvalidMoveException.class, () -> MoveNotation.parse("c3", Board.initial()));
    }
}
