package com.checkers.core;

import java.util.Objects;

/**
 * Immutable checkers piece. Promotion replaces a man with a new crowned value.
 */
public record Piece(PieceColor color, boolean king) {

    private static final Piece RED_MAN = new Piece(PieceColor.RED, false);
    private static final Piece RED_KING = new Piece(PieceColor.RED, true);
    private static final Piece BLACK_MAN = new Piece(PieceColor.BLACK, false);
    private static final Piece BLACK_KING = new Piece(PieceColor.BLACK, true);

    public Piece {
        Objects.requireNonNull(color, "color");
    }

    public static Piece man(PieceColor color) {
        return color == PieceColor.RED ? RED_MAN : BLACK_MAN;
    }

    public static Piece king(PieceColor color) {
        return color == PieceColor.RED ? RED_KING : BLACK_KING;
    }

    /**
     * Returns the crowned version of this piece.
     */
    public Piece crowned() {
        return king(color);
    }

    public boolean isMan() {
        return !king;
    }

    /**
     * Returns {@code true} if this piece may move or jump in the given row direction.
     */
    public boolean canMoveInRowDirection(int rowStep) {
        return king || rowStep == color.forwardRowStep();
    }

    /**
     * Returns {@code true} if this piece is a man standing on a row where it must be crowned.
     */
    public boolean mustPromoteOn(int row) {
        return !king && row == color.promotionRow();
    }
}
