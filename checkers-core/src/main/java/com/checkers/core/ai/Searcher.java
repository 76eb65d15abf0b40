package com.checkers.core.ai;

import com.checkers.core.Board;

/**
 * Generic interface for game tree search implementations.
 */
public interface Searcher {

    /**
     * Executes a search for the best move of the side to move on {@code board} under the supplied
     * {@link SearchConstraints}.
     *
     * @param board the position to analyse
     * @param constraints the limits guiding the search execution
     * @return the result of the search
     * @throws NoLegalMoveException if the side to move has no legal move
     */
    SearchResult search(Board board, SearchConstraints constraints);
}
