package com.checkers.core;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deliberately naive second implementation of the move rules, used as an oracle. It removes
 * jumped pieces immediately, which is equivalent for single-square jumps: a landing square never
 * coincides with a captured square, and an emptied square cannot be jumped.
 */
final class ReferenceRules {

    private static final int[] STEPS = {-1, 1};

    private ReferenceRules() {
    }

    static Set<Move> legalMoves(Board board) {
        Map<Square, Piece> pieces = new HashMap<>();
        for (Square square : Board.PLAYABLE_SQUARES) {
            board.pieceAt(square).ifPresent(piece -> pieces.put(square, piece));
        }
        PieceColor side = board.sideToMove();
        boolean continueAsKing = board.rules().continuesAfterCrowning();

        Set<Move> captures = new HashSet<>();
        for (Map.Entry<Square, Piece> entry : pieces.entrySet()) {
            if (entry.getValue().color() == side) {
                Map<Square, Piece> copy = new HashMap<>(pieces);
                copy.remove(entry.getKey());
                jumps(copy, entry.getKey(), entry.getKey(), entry.getValue(), false, new ArrayList<>(),
                        new ArrayList<>(), continueAsKing, captures);
            }
        }
        if (!captures.isEmpty()) {
            return captures;
        }

        Set<Move> steps = new HashSet<>();
        for (Map.Entry<Square, Piece> entry : pieces.entrySet()) {
            Piece piece = entry.getValue();
            if (piece.color() != side) {
                continue;
            }
            Square from = entry.getKey();
            for (int dr : STEPS) {
                if (!piece.king() && dr != side.forwardRowStep()) {
                    continue;
                }
                for (int dc : STEPS) {
                    int row = from.row() + dr;
                    int col = from.col() + dc;
                    if (Square.isOnBoard(row, col) && !pieces.containsKey(Square.of(row, col))) {
                        boolean promotes = !piece.king() && row == side.promotionRow();
                        steps.add(Move.step(from, Square.of(row, col), promotes));
                    }
                }
            }
        }
        return steps;
    }

    private static void jumps(Map<Square, Piece> pieces, Square origin, Square from, Piece moving, boolean promoted,
            List<Square> path, List<Square> captured, boolean continueAsKing, Set<Move> out) {
        boolean any = false;
        for (int dr : STEPS) {
            if (!moving.king() && dr != moving.color().forwardRowStep()) {
                continue;
            }
            for (int dc : STEPS) {
                int overRow = from.row() + dr;
                int overCol = from.col() + dc;
                int landRow = from.row() + 2 * dr;
                int landCol = from.col() + 2 * dc;
                if (!Square.isOnBoard(landRow, landCol)) {
                    continue;
                }
                Square over = Square.of(overRow, overCol);
                Square land = Square.of(landRow, landCol);
                Piece victim = pieces.get(over);
                if (victim == null || victim.color() == moving.color() || pieces.containsKey(land)) {
                    continue;
                }
                any = true;
                Map<Square, Piece> next = new HashMap<>(pieces);
                next.remove(over);
                List<Square> nextPath = new ArrayList<>(path);
                nextPath.add(land);
                List<Square> nextCaptured = new ArrayList<>(captured);
                nextCaptured.add(over);
                boolean crowns = !moving.king() && landRow == moving.color().promotionRow();
                if (crowns && !continueAsKing) {
                    out.add(Move.jump(origin, nextPath, nextCaptured, true));
                } else {
                    jumps(next, origin, land, crowns ? Piece.king(moving.color()) : moving, promoted || crowns,
                            nextPath, nextCaptured, continueAsKing, out);
                }
            }
        }
        if (!any && !captured.isEmpty()) {
            out.add(Move.jump(origin, path, captured, promoted));
        }
    }
}
