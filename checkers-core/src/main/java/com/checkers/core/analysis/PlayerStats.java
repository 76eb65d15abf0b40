package com.checkers.core.analysis;

/**
 * Per-player summary of analysed moves. Accuracy is the share of best and good moves, in percent.
 */
public record PlayerStats(double accuracy, int best, int good, int inaccuracies, int blunders, int totalMoves) {

    public static PlayerStats empty() {
        return new PlayerStats(0.0, 0, 0, 0, 0, 0);
    }
}
