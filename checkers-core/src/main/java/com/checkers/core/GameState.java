package com.checkers.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record of a checkers match: the current board, the moves played so far and the
 * bookkeeping needed for draw detection. The board itself knows nothing about draws.
 *
 * <p>A match is drawn when the same position (pieces and side to move) occurs for the third time,
 * or when {@link #DEFAULT_NO_PROGRESS_LIMIT} plies pass without a capture or a man moving. The side
 * to move may also resign, which hands the win to its opponent.
 */
public final class GameState {

    public static final int REPETITION_LIMIT = 3;
    public static final int DEFAULT_NO_PROGRESS_LIMIT = 80;

    private final Board board;
    private final List<Move> history;
    private final Map<Board, Integer> positionCounts;
    private final int pliesWithoutProgress;
    private final int noProgressLimit;
    private final PieceColor resigned;

    /**
     * Creates a match from the standard starting position.
     */
    public GameState() {
        this(new Board());
    }

    /**
     * Creates a match starting from an arbitrary position.
     */
    public GameState(Board board) {
        this(board, DEFAULT_NO_PROGRESS_LIMIT);
    }

    public GameState(Board board, int noProgressLimit) {
        this(Objects.requireNonNull(board, "board"), List.of(), Map.of(board, 1), 0, noProgressLimit, null);
        if (noProgressLimit < 1) {
            throw new IllegalArgumentException("noProgressLimit must be at least 1");
        }
    }

    private GameState(Board board, List<Move> history, Map<Board, Integer> positionCounts,
            int pliesWithoutProgress, int noProgressLimit, PieceColor resigned) {
        this.board = board;
        this.history = history;
        this.positionCounts = positionCounts;
        this.pliesWithoutProgress = pliesWithoutProgress;
        this.noProgressLimit = noProgressLimit;
        this.resigned = resigned;
    }

    public Board getBoard() {
        return board;
    }

    /**
     * Returns the number of plies played so far.
     */
    public int getMoveNumber() {
        return history.size();
    }

    public List<Move> history() {
        return history;
    }

    public int getPliesWithoutProgress() {
        return pliesWithoutProgress;
    }

    /**
     * Returns how many times the current position has occurred in this match.
     */
    public int repetitionCount() {
        return positionCounts.getOrDefault(board, 0);
    }

    /**
     * Derives the status from the current position: the side to move loses when it has no legal
     * move, otherwise repetition and the no-progress limit may end the match in a draw.
     */
    public GameStatus status() {
        if (resigned != null) {
            return GameStatus.won(resigned.opponent());
        }
        if (board.isTerminal()) {
            return GameStatus.won(board.sideToMove().opponent());
        }
        if (repetitionCount() >= REPETITION_LIMIT || pliesWithoutProgress >= noProgressLimit) {
            return GameStatus.drawn();
        }
        return GameStatus.ongoing();
    }

    public boolean isGameOver() {
        return status().isOver();
    }

    /**
     * Applies the provided move and returns the resulting state.
     *
     * @throws IllegalStateException if the match is already over
     * @throws InvalidMoveException  if the move is not legal in the current position
     */
    public GameState applyMove(Move move) {
        Objects.requireNonNull(move, "move");
        if (isGameOver()) {
            throw new IllegalStateException("Cannot play " + move + ": the game is over (" + status().kind() + ")");
        }

        boolean manMoved = board.pieceAt(move.origin()).map(Piece::isMan).orElse(false);
        Board updatedBoard = board.apply(move);

        List<Move> updatedHistory = new ArrayList<>(history.size() + 1);
        updatedHistory.addAll(history);
        updatedHistory.add(move);

        Map<Board, Integer> updatedCounts = new HashMap<>(positionCounts);
        updatedCounts.merge(updatedBoard, 1, Integer::sum);

        int quietPlies = move.isCapture() || manMoved ? 0 : pliesWithoutProgress + 1;
        return new GameState(updatedBoard, Collections.unmodifiableList(updatedHistory),
                Collections.unmodifiableMap(updatedCounts), quietPlies, noProgressLimit, null);
    }

    /**
     * Returns the state after the side to move resigns.
     *
     * @throws IllegalStateException if the match is already over
     */
    public GameState resign() {
        if (isGameOver()) {
            throw new IllegalStateException("Cannot resign: the game is over (" + status().kind() + ")");
        }
        return new GameState(board, history, positionCounts, pliesWithoutProgress, noProgressLimit,
                board.sideToMove());
    }
}
