package com.checkers.core;

/**
 * The two sides of a checkers match. RED starts at the bottom of the board (rows 5-7) and moves
 * first; BLACK starts at the top (rows 0-2).
 */
public enum PieceColor {
    RED(-1, 0, 7),
    BLACK(1, 7, 0);

    private final int forwardRowStep;
    private final int promotionRow;
    private final int homeRow;

    PieceColor(int forwardRowStep, int promotionRow, int homeRow) {
        this.forwardRowStep = forwardRowStep;
        this.promotionRow = promotionRow;
        this.homeRow = homeRow;
    }

    /**
     * Returns the row delta of a forward step for men of this color.
     */
    public int forwardRowStep() {
        return forwardRowStep;
    }

    /**
     * Returns the farthest row from this color's side, where its men are crowned.
     */
    public int promotionRow() {
        return promotionRow;
    }

    /**
     * Returns this color's own back row.
     */
    public int homeRow() {
        return homeRow;
    }

    public PieceColor opponent() {
        return this == RED ? BLACK : RED;
    }

    /**
     * Returns how many rows a man of this color standing on {@code row} still has to travel to be
     * crowned.
     */
    public int rowsToPromotion(int row) {
        return Math.abs(promotionRow - row);
    }
}
