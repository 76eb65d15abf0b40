package com.checkers.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Algebraic move notation: columns a-h from left to right, ranks 1-8 from the bottom of the
 * diagram. Steps are written {@code c3-d4}, capture chains {@code c3xe5xc7}.
 */
public final class MoveNotation {

    private MoveNotation() {
    }

    public static String formatSquare(Square square) {
        return String.valueOf((char) ('a' + square.col())) + (Square.SIZE - square.row());
    }

    public static Square parseSquare(String text) {
        Objects.requireNonNull(text, "text");
        String trimmed = text.trim().toLowerCase(Locale.ROOT);
        if (trimmed.length() != 2) {
            throw new IllegalArgumentException("Square must look like 'c3': " + text);
        }
        int col = trimmed.charAt(0) - 'a';
        int rank = trimmed.charAt(1) - '0';
        if (col < 0 || col >= Square.SIZE || rank < 1 || rank > Square.SIZE) {
            throw new IllegalArgumentException("Square out of range: " + text);
        }
        return new Square(Square.SIZE - rank, col);
    }

    public static String format(Move move) {
        String separator = move.isCapture() ? "x" : "-";
        StringBuilder builder = new StringBuilder(formatSquare(move.origin()));
        for (Square square : move.path()) {
            builder.append(separator).append(formatSquare(square));
        }
        return builder.toString();
    }

    /**
     * Resolves {@code text} to one of the legal moves of {@code board}. A capture chain may be given
     * in full or as origin and final square only, provided that identifies a single move.
     *
     * @throws InvalidMoveException if no legal move, or more than one, matches
     */
    public static Move parse(String text, Board board) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(board, "board");
        List<Square> squares = new ArrayList<>();
        for (String token : text.trim().split("[-x:]")) {
            if (!token.isBlank()) {
                squares.add(parseSquare(token));
            }
        }
        if (squares.size() < 2) {
            throw new InvalidMoveException("Move needs at least an origin and a target: " + text);
        }

        Square origin = squares.get(0);
        List<Square> path = squares.subList(1, squares.size());
        Move match = null;
        for (Move move : board.legalMoves()) {
            if (!move.origin().equals(origin)) {
                continue;
            }
            boolean fullPath = move.path().equals(path);
            boolean endpoints = path.size() == 1 && move.destination().equals(path.get(0));
            if (fullPath) {
                return move;
            }
            if (endpoints) {
                if (match != null) {
                    throw new InvalidMoveException("Move " + text + " is ambiguous, give the full capture path");
                }
                match = move;
            }
        }
        if (match == null) {
            throw new InvalidMoveException("Move " + text + " is not legal for " + board.sideToMove());
        }
        return match;
    }
}
