package com.checkers.core;

import java.util.List;
import java.util.Objects;

/**
 * A complete checkers move: either a single diagonal step or a chain of one or more jumps.
 *
 * @param origin   the square the moving piece starts on
 * @param path     the landing squares after the origin, in order
 * @param captured the squares of the jumped pieces, one per landing square; empty for a step
 * @param promotes whether the moving man is crowned by this move
 */
public record Move(Square origin, List<Square> path, List<Square> captured, boolean promotes) {

    public Move {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(captured, "captured");
        path = List.copyOf(path);
        captured = List.copyOf(captured);
        validateShape(origin, path, captured);
    }

    /**
     * Creates a single non-capturing diagonal step.
     */
    public static Move step(Square origin, Square target, boolean promotes) {
        return new Move(origin, List.of(target), List.of(), promotes);
    }

    /**
     * Creates a capture chain.
     */
    public static Move jump(Square origin, List<Square> path, List<Square> captured, boolean promotes) {
        if (captured.isEmpty()) {
            throw new InvalidMoveException("A jump must capture at least one piece");
        }
        return new Move(origin, path, captured, promotes);
    }

    public boolean isCapture() {
        return !captured.isEmpty();
    }

    public int jumpCount() {
        return captured.size();
    }

    /**
     * Returns the square the moving piece finally lands on.
     */
    public Square destination() {
        return path.get(path.size() - 1);
    }

    @Override
    public String toString() {
        return MoveNotation.format(this);
    }

    private static void validateShape(Square origin, List<Square> path, List<Square> captured) {
        if (path.isEmpty()) {
            throw new InvalidMoveException("Move path must not be empty");
        }
        if (!origin.isPlayable()) {
            throw new InvalidMoveException("Origin " + origin + " is not a playable square");
        }
        if (captured.isEmpty()) {
            if (path.size() != 1) {
                throw new InvalidMoveException("A non-capturing move is a single step, got " + path.size());
            }
            if (diagonalDistance(origin, path.get(0)) != 1) {
                throw new InvalidMoveException("Step " + origin + "-" + path.get(0) + " is not a diagonal step");
            }
            return;
        }
        if (captured.size() != path.size()) {
            throw new InvalidMoveException("Capture chain needs one captured square per jump: path="
                    + path.size() + ", captured=" + captured.size());
        }
        Square from = origin;
        for (int i = 0; i < path.size(); i++) {
            Square to = path.get(i);
            if (diagonalDistance(from, to) != 2) {
                throw new InvalidMoveException("Jump " + from + "x" + to + " is not a diagonal jump");
            }
            Square over = captured.get(i);
            if (over.row() != (from.row() + to.row()) / 2 || over.col() != (from.col() + to.col()) / 2) {
                throw new InvalidMoveException("Captured square " + over + " is not between " + from + " and " + to);
            }
            from = to;
        }
    }

    private static int diagonalDistance(Square from, Square to) {
        int rows = Math.abs(to.row() - from.row());
        int cols = Math.abs(to.col() - from.col());
        return rows == cols ? rows : -1;
    }
}
