package com.checkers.core.ai;

import com.checkers.core.PieceColor;

/**
 * Thrown when a search is requested for a side that has no legal move left.
 */
public class NoLegalMoveException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final PieceColor side;

    public NoLegalMoveException(PieceColor side) {
        super("No legal moves available for " + side);
        this.side = side;
    }

    public PieceColor side() {
        return side;
    }
}
