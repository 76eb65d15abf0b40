package com.checkers.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Legal move generation: mandatory captures, maximal capture chains, then simple steps.
 */
final class MoveGenerator {

    // up-left, up-right, down-left, down-right
    private static final int[][] DIRECTIONS = {{-1, -1}, {-1, 1}, {1, -1}, {1, 1}};

    private MoveGenerator() {
    }

    static List<Move> generate(Board board, PieceColor color) {
        List<Move> captures = new ArrayList<>();
        for (Square square : Board.PLAYABLE_SQUARES) {
            Piece piece = board.get(square);
            if (piece != null && piece.color() == color) {
                collectCaptures(board, square, piece, captures);
            }
        }
        if (!captures.isEmpty()) {
            return captures;
        }

        List<Move> steps = new ArrayList<>();
        for (Square square : Board.PLAYABLE_SQUARES) {
            Piece piece = board.get(square);
            if (piece != null && piece.color() == color) {
                collectSteps(board, square, piece, steps);
            }
        }
        return steps;
    }

    static int countJumpStarts(Board board, PieceColor color) {
        int count = 0;
        for (Square square : Board.PLAYABLE_SQUARES) {
            Piece piece = board.get(square);
            if (piece == null || piece.color() != color) {
                continue;
            }
            for (int[] direction : DIRECTIONS) {
                if (!piece.canMoveInRowDirection(direction[0])) {
                    continue;
                }
                Square over = square.offset(direction[0], direction[1], 1);
                Square landing = square.offset(direction[0], direction[1], 2);
                if (landing == null) {
                    continue;
                }
                Piece victim = board.get(over);
                if (victim != null && victim.color() != color && board.get(landing) == null) {
                    count++;
                }
            }
        }
        return count;
    }

    private static void collectSteps(Board board, Square origin, Piece piece, List<Move> out) {
        for (int[] direction : DIRECTIONS) {
            if (!piece.canMoveInRowDirection(direction[0])) {
                continue;
            }
            Square target = origin.offset(direction[0], direction[1], 1);
            if (target != null && board.get(target) == null) {
                out.add(Move.step(origin, target, piece.mustPromoteOn(target.row())));
            }
        }
    }

    private static void collectCaptures(Board board, Square origin, Piece piece, List<Move> out) {
        extendChain(board, origin, origin, piece, false, new ArrayList<>(), new ArrayList<>(), out);
    }

    /**
     * Depth-first walk over the jump tree rooted at {@code origin}. Jumped pieces stay on the board
     * until the chain completes, so they block landings and cannot be jumped twice. Only chains
     * that cannot be extended are emitted.
     */
    private static void extendChain(Board board, Square origin, Square from, Piece moving, boolean crowned,
            List<Square> path, List<Square> captured, List<Move> out) {
        boolean extended = false;
        for (int[] direction : DIRECTIONS) {
            if (!moving.canMoveInRowDirection(direction[0])) {
                continue;
            }
            Square over = from.offset(direction[0], direction[1], 1);
            Square landing = from.offset(direction[0], direction[1], 2);
            if (landing == null) {
                continue;
            }
            Piece victim = board.get(over);
            if (victim == null || victim.color() == moving.color() || captured.contains(over)) {
                continue;
            }
            if (board.get(landing) != null && !landing.equals(origin)) {
                continue;
            }

            extended = true;
            path.add(landing);
            captured.add(over);
            boolean crownsHere = moving.mustPromoteOn(landing.row());
            if (crownsHere && !board.rules().continuesAfterCrowning()) {
                out.add(Move.jump(origin, path, captured, true));
            } else {
                Piece next = crownsHere ? moving.crowned() : moving;
                extendChain(board, origin, landing, next, crowned || crownsHere, path, captured, out);
            }
            path.remove(path.size() - 1);
            captured.remove(captured.size() - 1);
        }

        if (!extended && !captured.isEmpty()) {
            out.add(Move.jump(origin, path, captured, crowned));
        }
    }
}
