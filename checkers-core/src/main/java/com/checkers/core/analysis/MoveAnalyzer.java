package com.checkers.core.analysis;

import com.checkers.core.Board;
import com.checkers.core.InvalidMoveException;
import com.checkers.core.Move;
import com.checkers.core.PieceColor;
import com.checkers.core.ai.AlphaBetaAI;
import com.checkers.core.ai.ScoredMove;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Grades played moves by comparing them with the engine's evaluation of every alternative, and
 * summarises a match.
 */
public final class MoveAnalyzer {

    private static final Logger LOGGER = Logger.getLogger(MoveAnalyzer.class.getName());

    public static final int BEST_THRESHOLD = 20;
    public static final int GOOD_THRESHOLD = 80;
    public static final int INACCURACY_THRESHOLD = 150;
    private static final int TOP_MOVES = 5;
    private static final double MAN_VALUE = 100.0;

    private final AlphaBetaAI ai;

    public MoveAnalyzer(AlphaBetaAI ai) {
        this.ai = Objects.requireNonNull(ai, "ai");
    }

    /**
     * Analyses {@code played} in the position {@code before}.
     *
     * @throws InvalidMoveException if {@code played} is not legal in {@code before}
     */
    public MoveAnalysis analyze(Board before, Move played, int moveNumber) {
        Objects.requireNonNull(before, "before");
        Objects.requireNonNull(played, "played");
        PieceColor player = before.sideToMove();
        if (!before.legalMoves().contains(played)) {
            throw new InvalidMoveException("Move " + played + " is not legal for " + player);
        }

        List<ScoredMove> scored = ai.scoreMoves(before);
        ScoredMove best = scored.get(0);
        ScoredMove actual = scored.stream()
                .filter(candidate -> candidate.move().equals(played))
                .findFirst()
                .orElseThrow();

        List<ScoredMove> topMoves = scored.subList(0, Math.min(TOP_MOVES, scored.size()));
        if (scored.size() == 1) {
            return new MoveAnalysis(moveNumber, player, played, MoveClassification.BEST, 0, best.score(),
                    actual.score(), "Only move available", topMoves);
        }

        int difference;
        MoveClassification classification;
        if (best.move().equals(played)) {
            difference = 0;
            classification = MoveClassification.BEST;
        } else {
            difference = Math.max(0, best.score() - actual.score());
            classification = classify(difference);
        }
        String description = describe(classification, difference, topMoves.size());
        LOGGER.fine(() -> String.format("Move %d (%s) %s: %s, lost %d", moveNumber, player, played,
                classification, difference));
        return new MoveAnalysis(moveNumber, player, played, classification, difference, best.score(), actual.score(),
                description, topMoves);
    }

    public static MoveClassification classify(int scoreDifference) {
        if (scoreDifference <= BEST_THRESHOLD) {
            return MoveClassification.BEST;
        }
        if (scoreDifference <= GOOD_THRESHOLD) {
            return MoveClassification.GOOD;
        }
        if (scoreDifference <= INACCURACY_THRESHOLD) {
            return MoveClassification.INACCURACY;
        }
        return MoveClassification.BLUNDER;
    }

    public static PlayerStats playerStats(List<MoveAnalysis> analyses, PieceColor player) {
        List<MoveAnalysis> own = forPlayer(analyses, player);
        if (own.isEmpty()) {
            return PlayerStats.empty();
        }
        Map<MoveClassification, Integer> counts = distribution(own);
        int best = counts.get(MoveClassification.BEST);
        int good = counts.get(MoveClassification.GOOD);
        double accuracy = (best + good) * 100.0 / own.size();
        return new PlayerStats(accuracy, best, good, counts.get(MoveClassification.INACCURACY),
                counts.get(MoveClassification.BLUNDER), own.size());
    }

    /**
     * Counts analyses per classification; every classification is present in the result.
     */
    public static Map<MoveClassification, Integer> distribution(List<MoveAnalysis> analyses) {
        Map<MoveClassification, Integer> counts = new EnumMap<>(MoveClassification.class);
        for (MoveClassification classification : MoveClassification.values()) {
            counts.put(classification, 0);
        }
        for (MoveAnalysis analysis : analyses) {
            counts.merge(analysis.classification(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Returns the player's best moves in match order.
     */
    public static List<MoveAnalysis> bestMoves(List<MoveAnalysis> analyses, PieceColor player, int limit) {
        return forPlayer(analyses, player).stream()
                .filter(analysis -> analysis.classification() == MoveClassification.BEST)
                .sorted(Comparator.comparingInt(MoveAnalysis::moveNumber))
                .limit(limit)
                .collect(Collectors.toList());
    }

    /**
     * Returns the player's blunders, most costly first.
     */
    public static List<MoveAnalysis> blunders(List<MoveAnalysis> analyses, PieceColor player, int limit) {
        return worstOf(analyses, player, MoveClassification.BLUNDER, limit);
    }

    /**
     * Returns the player's inaccuracies, most costly first.
     */
    public static List<MoveAnalysis> inaccuracies(List<MoveAnalysis> analyses, PieceColor player, int limit) {
        return worstOf(analyses, player, MoveClassification.INACCURACY, limit);
    }

    public static String report(List<MoveAnalysis> analyses) {
        if (analyses.isEmpty()) {
            return "No moves to analyze.";
        }
        List<String> lines = new ArrayList<>();
        lines.add("MOVE ANALYSIS REPORT");
        lines.add("=".repeat(50));
        lines.add("Total Moves Analyzed: " + analyses.size());
        Map<MoveClassification, Integer> counts = distribution(analyses);
        for (MoveClassification classification : MoveClassification.values()) {
            int count = counts.get(classification);
            lines.add(String.format(Locale.ROOT, "%s: %d (%.1f%%)", plural(classification), count,
                    count * 100.0 / analyses.size()));
        }
        lines.add("");
        for (PieceColor player : PieceColor.values()) {
            PlayerStats stats = playerStats(analyses, player);
            lines.add(player + " PLAYER:");
            lines.add(String.format(Locale.ROOT, "  Accuracy: %.1f%%", stats.accuracy()));
            lines.add("  Best Moves: " + stats.best());
            lines.add("  Good Moves: " + stats.good());
            lines.add("  Inaccuracies: " + stats.inaccuracies());
            lines.add("  Blunders: " + stats.blunders());
            lines.add("");
        }
        return String.join("\n", lines);
    }

    private static String describe(MoveClassification classification, int difference, int alternatives) {
        double menEquivalent = difference / MAN_VALUE;
        switch (classification) {
            case BEST:
                return alternatives > 0 ? "Best move! (" + alternatives + " alternatives)" : "Best move!";
            case GOOD:
                return String.format(Locale.ROOT, "Good move, slight advantage loss (%d points, ~%.1f men)",
                        difference, menEquivalent);
            case INACCURACY:
                return String.format(Locale.ROOT, "Inaccuracy, moderate advantage loss (%d points, ~%.1f men)",
                        difference, menEquivalent);
            default:
                return String.format(Locale.ROOT, "Blunder! Major advantage loss (%d points, ~%.1f men)",
                        difference, menEquivalent);
        }
    }

    private static String plural(MoveClassification classification) {
        switch (classification) {
            case BEST:
                return "Best Moves";
            case GOOD:
                return "Good Moves";
            case INACCURACY:
                return "Inaccuracies";
            default:
                return "Blunders";
        }
    }

    private static List<MoveAnalysis> worstOf(List<MoveAnalysis> analyses, PieceColor player,
            MoveClassification classification, int limit) {
        return forPlayer(analyses, player).stream()
                .filter(analysis -> analysis.classification() == classification)
                .sorted(Comparator.comparingInt(MoveAnalysis::scoreDifference).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    private static List<MoveAnalysis> forPlayer(List<MoveAnalysis> analyses, PieceColor player) {
        return analyses.stream()
                .filter(analysis -> analysis.player() == player)
                .collect(Collectors.toList());
    }
}
