package com.checkers.core;

/**
 * Coordinate on the 8x8 board. Row 0 is the top row of the diagram, column 0 the leftmost column.
 */
public record Square(int row, int col) {

    public static final int SIZE = 8;

    public Square {
        if (row < 0 || row >= SIZE || col < 0 || col >= SIZE) {
            throw new IllegalArgumentException("Square out of range: (" + row + ", " + col + ")");
        }
    }

    public static Square of(int row, int col) {
        return new Square(row, col);
    }

    /**
     * Returns {@code true} if both coordinates lie on the board.
     */
    public static boolean isOnBoard(int row, int col) {
        return row >= 0 && row < SIZE && col >= 0 && col < SIZE;
    }

    /**
     * Returns {@code true} if this is one of the 32 dark squares pieces may occupy.
     */
    public boolean isPlayable() {
        return ((row + col) & 1) == 1;
    }

    /**
     * Returns the square {@code distance} diagonal steps away, or {@code null} if it is off the board.
     */
    public Square offset(int rowStep, int colStep, int distance) {
        int targetRow = row + rowStep * distance;
        int targetCol = col + colStep * distance;
        return isOnBoard(targetRow, targetCol) ? new Square(targetRow, targetCol) : null;
    }

    /**
     * Returns the row-major index of this square in the range 0-63.
     */
    public int index() {
        return row * SIZE + col;
    }

    @Override
    public String toString() {
        return MoveNotation.formatSquare(this);
    }
}
