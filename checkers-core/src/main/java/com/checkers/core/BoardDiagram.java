package com.checkers.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Plain-text board diagrams. Each of the eight rows is written top to bottom using {@code r}/{@code R}
 * for a red man/king, {@code b}/{@code B} for a black man/king and {@code .} for an empty square.
 * Whitespace inside a row is ignored when parsing.
 */
public final class BoardDiagram {

    private BoardDiagram() {
    }

    public static Board parse(String diagram, PieceColor sideToMove) {
        return parse(diagram, sideToMove, RuleSet.STANDARD);
    }

    /**
     * Builds a board from a diagram.
     *
     * @throws IllegalArgumentException if the diagram does not describe a valid position
     */
    public static Board parse(String diagram, PieceColor sideToMove, RuleSet rules) {
        Objects.requireNonNull(diagram, "diagram");
        List<String> rows = new ArrayList<>();
        for (String line : diagram.split("\\R")) {
            String compact = line.replaceAll("\\s+", "");
            if (!compact.isEmpty()) {
                rows.add(compact);
            }
        }
        if (rows.size() != Square.SIZE) {
            throw new IllegalArgumentException("Diagram must have 8 rows, found " + rows.size());
        }

        Board board = Board.empty(sideToMove, rules);
        for (int row = 0; row < Square.SIZE; row++) {
            String cells = rows.get(row);
            if (cells.length() != Square.SIZE) {
                throw new IllegalArgumentException("Row " + row + " must have 8 cells: " + cells);
            }
            for (int col = 0; col < Square.SIZE; col++) {
                char symbol = cells.charAt(col);
                if (symbol == '.') {
                    continue;
                }
                board = board.withPiece(new Square(row, col), toPiece(symbol));
            }
        }
        return board;
    }

    public static String render(Board board) {
        StringBuilder builder = new StringBuilder();
        for (int row = 0; row < Square.SIZE; row++) {
            for (int col = 0; col < Square.SIZE; col++) {
                if (col > 0) {
                    builder.append(' ');
                }
                builder.append(symbol(board, new Square(row, col)));
            }
            builder.append('\n');
        }
        return builder.toString();
    }

    /**
     * Renders the board with rank numbers on the left and file letters underneath.
     */
    public static String renderWithCoordinates(Board board) {
        StringBuilder builder = new StringBuilder();
        for (int row = 0; row < Square.SIZE; row++) {
            builder.append(Square.SIZE - row).append(' ');
            for (int col = 0; col < Square.SIZE; col++) {
                builder.append(' ').append(symbol(board, new Square(row, col)));
            }
            builder.append('\n');
        }
        builder.append("   a b c d e f g h\n");
        return builder.toString();
    }

    public static char symbol(Piece piece) {
        char symbol = piece.color() == PieceColor.RED ? 'r' : 'b';
        return piece.king() ? Character.toUpperCase(symbol) : symbol;
    }

    private static char symbol(Board board, Square square) {
        return board.pieceAt(square).map(BoardDiagram::symbol).orElse('.');
    }

    private static Piece toPiece(char symbol) {
        switch (symbol) {
            case 'r':
                return Piece.man(PieceColor.RED);
            case 'R':
                return Piece.king(PieceColor.RED);
            case 'b':
                return Piece.man(PieceColor.BLACK);
            case 'B':
                return Piece.king(PieceColor.BLACK);
            default:
                throw new IllegalArgumentException("Unknown diagram symbol '" + symbol + "'");
        }
    }
}
