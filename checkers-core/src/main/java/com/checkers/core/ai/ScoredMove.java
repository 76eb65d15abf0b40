package com.checkers.core.ai;

import com.checkers.core.Move;

/**
 * A root move together with its searched value from the mover's perspective.
 */
public record ScoredMove(Move move, int score) {
}
