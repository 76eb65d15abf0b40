package com.checkers.core.ai;

import com.checkers.core.Move;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders moves so that alpha-beta finds cutoffs early: captures before steps, longer capture chains
 * first. The sort is stable, so equally ranked moves keep their generation order.
 */
public final class MoveOrdering {

    private static final Comparator<Move> CAPTURES_FIRST =
            Comparator.comparingInt(Move::jumpCount).reversed();

    private MoveOrdering() {
    }

    public static List<Move> order(List<Move> moves) {
        List<Move> ordered = new ArrayList<>(moves);
        ordered.sort(CAPTURES_FIRST);
        return ordered;
    }
}
