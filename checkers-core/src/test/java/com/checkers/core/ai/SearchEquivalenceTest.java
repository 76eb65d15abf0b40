package com.checkers.core.ai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.checkers.core.Board;
import com.checkers.core.RandomBoards;
import java.util.List;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class SearchEquivalenceTest {

    private static final List<Board> BOARDS = RandomBoards.midGames(20240917L, 24);

    static Stream<Arguments> boardsAndDepths() {
        return IntStream.range(0, BOARDS.size()).boxed()
                .flatMap(i -> IntStream.rangeClosed(1, 4).mapToObj(depth -> Arguments.of(i, depth)));
    }

    @ParameterizedTest(name = "board {0} at depth {1}")
    @MethodSource("boardsAndDepths")
    void pruningNeverChangesTheAnswer(int index, int depth) {
        Board board = BOARDS.get(index);

        SearchResult pruned = new AlphaBetaAI(depth).search(board, SearchConstraints.depth(depth));
        SearchResult full = new MinimaxAI(depth).search(board, SearchConstraints.depth(depth));

        assertEquals(full.move(), pruned.move(), board::toString);
        assertEquals(full.score(), pruned.score(), board::toString);
        assertTrue(pruned.visitedNodes() <= full.visitedNodes());
    }

    @Test
    void pruningSavesWorkOverall() {
        long cutoffs = 0L;
        long prunedNodes = 0L;
        long fullNodes = 0L;
        for (Board board : BOARDS) {
            SearchResult pruned = new AlphaBetaAI(4).search(board, SearchConstraints.depth(4));
            cutoffs += pruned.statistics().totalCutoffs();
            prunedNodes += pruned.visitedNodes();
            fullNodes += new MinimaxAI(4).search(board, SearchConstraints.depth(4)).visitedNodes();
        }

        assertTrue(cutoffs > 0);
        assertTrue(prunedNodes < fullNodes);
    }
}
