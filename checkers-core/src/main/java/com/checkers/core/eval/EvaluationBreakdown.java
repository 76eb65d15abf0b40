package com.checkers.core.eval;

/**
 * Per-term view of an evaluation, each term already relative to the requested perspective.
 */
public record EvaluationBreakdown(int material, int positional, int advancement, int mobility, int threats) {

    public int total() {
        return material + positional + advancement + mobility + threats;
    }
}
