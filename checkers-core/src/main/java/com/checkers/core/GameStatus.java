package com.checkers.core;

import java.util.Objects;

/**
 * Outcome of a match at a given moment: still ongoing, won by one color, or drawn.
 *
 * @param kind   the outcome category
 * @param winner the winning color for {@link Kind#WON}, otherwise {@code null}
 */
public record GameStatus(Kind kind, PieceColor winner) {

    private static final GameStatus ONGOING = new GameStatus(Kind.ONGOING, null);
    private static final GameStatus DRAWN = new GameStatus(Kind.DRAWN, null);

    public GameStatus {
        Objects.requireNonNull(kind, "kind");
        if ((kind == Kind.WON) != (winner != null)) {
            throw new IllegalArgumentException("A winner is required exactly for won games");
        }
    }

    public static GameStatus ongoing() {
        return ONGOING;
    }

    public static GameStatus won(PieceColor winner) {
        return new GameStatus(Kind.WON, Objects.requireNonNull(winner, "winner"));
    }

    public static GameStatus drawn() {
        return DRAWN;
    }

    public boolean isOver() {
        return kind != Kind.ONGOING;
    }

    public enum Kind {
        ONGOING,
        WON,
        DRAWN
    }
}
