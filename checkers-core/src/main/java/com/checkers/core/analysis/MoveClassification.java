package com.checkers.core.analysis;

/**
 * Quality grade of a played move, by how much value it gives up against the best move.
 */
public enum MoveClassification {
    BEST("Best"),
    GOOD("Good"),
    INACCURACY("Inaccuracy"),
    BLUNDER("Blunder");

    private final String label;

    MoveClassification(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
