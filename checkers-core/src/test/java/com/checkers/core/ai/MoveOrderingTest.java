package com.checkers.core.ai;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.checkers.core.Move;
import com.checkers.core.Square;
import java.util.List;
import org.junit.jupiter.api.Test;

class MoveOrderingTest {

    @Test
    void longerChainsComeFirstAndTiesKeepTheirOrder() {
        Move stepA = Move.step(Square.of(5, 0), Square.of(4, 1), false);
        Move stepB = Move.step(Square.of(5, 2), Square.of(4, 3), false);
        Move single = Move.jump(Square.of(5, 6), List.of(Square.of(3, 4)), List.of(Square.of(4, 5)), false);
        Move dbl = Move.jump(Square.of(6, 3), List.of(Square.of(4, 5), Square.of(2, 7)),
                List.of(Square.of(5, 4), Square.of(3, 6)), false);

        List<Move> ordered = MoveOrdering.order(List.of(stepA, single, stepB, dbl));

        assertEquals(List.of(dbl, single, stepA, stepB), ordered);
    }
}
