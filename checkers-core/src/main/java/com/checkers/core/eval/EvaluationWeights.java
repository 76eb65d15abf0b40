package com.checkers.core.eval;

/**
 * Weights combined by {@link Evaluator}. All values are in centi-men: a man is worth 100.
 *
 * @param manValue            material value of a man
 * @param kingValue           material value of a king
 * @param centerBonus         bonus per piece on the central 4x4 block
 * @param backRowBonus        bonus per man still guarding its own back row
 * @param edgeBonus           bonus per piece on the a- or h-file
 * @param advancementBonus    bonus per man close to promotion
 * @param advancementRows     how close (in rows) a man must be to earn the advancement bonus
 * @param mobilityWeight      weight per legal move
 * @param captureThreatWeight weight per jump a color could start
 */
public record EvaluationWeights(
        int manValue,
        int kingValue,
        int centerBonus,
        int backRowBonus,
        int edgeBonus,
        int advancementBonus,
        int advancementRows,
        int mobilityWeight,
        int captureThreatWeight) {

    public static final EvaluationWeights DEFAULT = new EvaluationWeights(100, 300, 10, 20, 5, 25, 2, 2, 15);

    /**
     * Material only, useful where positional noise gets in the way.
     */
    public static final EvaluationWeights MATERIAL_ONLY = new EvaluationWeights(100, 300, 0, 0, 0, 0, 0, 0, 0);

    public EvaluationWeights {
        if (manValue <= 0) {
            throw new IllegalArgumentException("manValue must be positive");
        }
        if (kingValue < manValue) {
            throw new IllegalArgumentException("kingValue must be at least manValue");
        }
        if (centerBonus < 0 || backRowBonus < 0 || edgeBonus < 0 || advancementBonus < 0 || advancementRows < 0
                || mobilityWeight < 0 || captureThreatWeight < 0) {
            throw new IllegalArgumentException("Evaluation weights must not be negative");
        }
        if (advancementRows >= 7) {
            throw new IllegalArgumentException("advancementRows must be below 7");
        }
    }

    public EvaluationWeights withKingValue(int value) {
        return new EvaluationWeights(manValue, value, centerBonus, backRowBonus, edgeBonus, advancementBonus,
                advancementRows, mobilityWeight, captureThreatWeight);
    }

    public EvaluationWeights withMobilityWeight(int weight) {
        return new EvaluationWeights(manValue, kingValue, centerBonus, backRowBonus, edgeBonus, advancementBonus,
                advancementRows, weight, captureThreatWeight);
    }
}
