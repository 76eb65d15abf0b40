package com.checkers.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable 8x8 checkers position: the placement of all pieces, the side to move and the rule
 * variant in force. Applying a move returns a new instance.
 *
 * <p>Legal move lists are computed lazily and memoised per instance, so repeated queries (and the
 * legality check inside {@link #apply(Move)}) are cheap.
 */
public final class Board {

    public static final int SIZE = Square.SIZE;
    public static final int PIECES_PER_SIDE = 12;
    public static final List<Square> PLAYABLE_SQUARES = playableSquares();

    private final Piece[] cells;
    private final PieceColor sideToMove;
    private final RuleSet rules;

    private List<Move> redMoves;
    private List<Move> blackMoves;

    /**
     * Creates the standard starting position with RED to move.
     */
    public Board() {
        this(RuleSet.STANDARD);
    }

    /**
     * Creates the standard starting position with RED to move under the supplied rules.
     */
    public Board(RuleSet rules) {
        this(startingCells(), PieceColor.RED, Objects.requireNonNull(rules, "rules"));
    }

    private Board(Piece[] cells, PieceColor sideToMove, RuleSet rules) {
        this.cells = cells;
        this.sideToMove = sideToMove;
        this.rules = rules;
    }

    public static Board initial() {
        return new Board();
    }

    public static Board initial(RuleSet rules) {
        return new Board(rules);
    }

    /**
     * Returns a board without pieces, used to set up arbitrary positions.
     */
    public static Board empty(PieceColor sideToMove) {
        return empty(sideToMove, RuleSet.STANDARD);
    }

    public static Board empty(PieceColor sideToMove, RuleSet rules) {
        Objects.requireNonNull(sideToMove, "sideToMove");
        Objects.requireNonNull(rules, "rules");
        return new Board(new Piece[SIZE * SIZE], sideToMove, rules);
    }

    public PieceColor sideToMove() {
        return sideToMove;
    }

    public RuleSet rules() {
        return rules;
    }

    public Optional<Piece> pieceAt(Square square) {
        return Optional.ofNullable(cells[square.index()]);
    }

    public boolean isEmpty(Square square) {
        return cells[square.index()] == null;
    }

    /**
     * Returns the squares occupied by the given color in row-major order.
     */
    public List<Square> occupiedSquares(PieceColor color) {
        List<Square> squares = new ArrayList<>(PIECES_PER_SIDE);
        for (Square square : PLAYABLE_SQUARES) {
            Piece piece = cells[square.index()];
            if (piece != null && piece.color() == color) {
                squares.add(square);
            }
        }
        return squares;
    }

    public int count(PieceColor color) {
        int count = 0;
        for (Piece piece : cells) {
            if (piece != null && piece.color() == color) {
                count++;
            }
        }
        return count;
    }

    public int countKings(PieceColor color) {
        int count = 0;
        for (Piece piece : cells) {
            if (piece != null && piece.king() && piece.color() == color) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns a copy of this board with {@code piece} placed on {@code square}.
     *
     * @throws IllegalArgumentException if the square is not playable or the piece is a man on its
     *                                  promotion row
     */
    public Board withPiece(Square square, Piece piece) {
        Objects.requireNonNull(square, "square");
        Objects.requireNonNull(piece, "piece");
        if (!square.isPlayable()) {
            throw new IllegalArgumentException("Square " + square + " is not playable");
        }
        if (piece.mustPromoteOn(square.row())) {
            throw new IllegalArgumentException("A " + piece.color() + " man cannot stand on its promotion row at "
                    + square);
        }
        Piece[] updated = cells.clone();
        updated[square.index()] = piece;
        return new Board(updated, sideToMove, rules);
    }

    public Board withoutPiece(Square square) {
        Objects.requireNonNull(square, "square");
        Piece[] updated = cells.clone();
        updated[square.index()] = null;
        return new Board(updated, sideToMove, rules);
    }

    public Board withSideToMove(PieceColor side) {
        Objects.requireNonNull(side, "side");
        return side == sideToMove ? this : new Board(cells, side, rules);
    }

    /**
     * Returns the legal moves of the side to move.
     */
    public List<Move> legalMoves() {
        return movesFor(sideToMove);
    }

    /**
     * Returns the legal moves of {@code side}, which must be the side to move.
     *
     * @throws InvalidStateException if {@code side} is not the side to move
     */
    public List<Move> legalMoves(PieceColor side) {
        Objects.requireNonNull(side, "side");
        if (side != sideToMove) {
            throw new InvalidStateException("Requested moves for " + side + " but " + sideToMove + " is to move");
        }
        return movesFor(side);
    }

    /**
     * Returns how many moves {@code color} would have if it were to move now.
     */
    public int mobility(PieceColor color) {
        Objects.requireNonNull(color, "color");
        return movesFor(color).size();
    }

    /**
     * Returns how many single jumps the pieces of {@code color} could start right now.
     */
    public int jumpOpportunities(PieceColor color) {
        Objects.requireNonNull(color, "color");
        return MoveGenerator.countJumpStarts(this, color);
    }

    /**
     * Returns {@code true} if the side to move has no legal move and has therefore lost.
     */
    public boolean isTerminal() {
        return legalMoves().isEmpty();
    }

    /**
     * Plays a legal move and returns the resulting board with the turn passed to the opponent.
     *
     * @throws InvalidMoveException if the move is not legal on this board
     */
    public Board apply(Move move) {
        Objects.requireNonNull(move, "move");
        if (!legalMoves().contains(move)) {
            throw new InvalidMoveException("Move " + move + " is not legal for " + sideToMove);
        }

        Piece[] updated = cells.clone();
        Piece moving = updated[move.origin().index()];
        updated[move.origin().index()] = null;
        for (Square captured : move.captured()) {
            updated[captured.index()] = null;
        }
        updated[move.destination().index()] = move.promotes() ? moving.crowned() : moving;
        return new Board(updated, sideToMove.opponent(), rules);
    }

    Piece get(Square square) {
        return cells[square.index()];
    }

    private List<Move> movesFor(PieceColor color) {
        if (color == PieceColor.RED) {
            List<Move> moves = redMoves;
            if (moves == null) {
                moves = Collections.unmodifiableList(MoveGenerator.generate(this, color));
                redMoves = moves;
            }
            return moves;
        }
        List<Move> moves = blackMoves;
        if (moves == null) {
            moves = Collections.unmodifiableList(MoveGenerator.generate(this, color));
            blackMoves = moves;
        }
        return moves;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Board)) {
            return false;
        }
        Board that = (Board) other;
        return sideToMove == that.sideToMove && rules.equals(that.rules) && Arrays.equals(cells, that.cells);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(cells) + sideToMove.hashCode()) + rules.hashCode();
    }

    @Override
    public String toString() {
        return BoardDiagram.render(this);
    }

    private static Piece[] startingCells() {
        Piece[] cells = new Piece[SIZE * SIZE];
        for (Square square : PLAYABLE_SQUARES) {
            if (square.row() < 3) {
                cells[square.index()] = Piece.man(PieceColor.BLACK);
            } else if (square.row() >= SIZE - 3) {
                cells[square.index()] = Piece.man(PieceColor.RED);
            }
        }
        return cells;
    }

    private static List<Square> playableSquares() {
        List<Square> squares = new ArrayList<>(SIZE * SIZE / 2);
        for (int row = 0; row < SIZE; row++) {
            for (int col = 0; col < SIZE; col++) {
                Square square = new Square(row, col);
                if (square.isPlayable()) {
                    squares.add(square);
                }
            }
        }
        return List.copyOf(squares);
    }
}
