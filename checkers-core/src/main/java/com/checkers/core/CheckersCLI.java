package com.checkers.core;

import com.checkers.core.ai.AIConfig;
import com.checkers.core.ai.AlphaBetaAI;
import com.checkers.core.ai.SearchResult;
import com.checkers.core.analysis.MoveAnalysis;
import com.checkers.core.analysis.MoveAnalyzer;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Scanner;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Console front-end: a human plays RED against the engine, or the engine plays both sides.
 */
public final class CheckersCLI {

    private static final Logger LOGGER = Logger.getLogger(CheckersCLI.class.getName());

    private CheckersCLI() {
    }

    public static void main(String[] args) {
        configureLogging();
        AIConfig config;
        RuleSet rules;
        boolean selfPlay = false;
        boolean analyze = false;
        try {
            config = AIConfig.fromSystemProperties();
            rules = RuleSet.fromSystemProperties();
            for (String arg : args) {
                if ("--selfplay".equals(arg)) {
                    selfPlay = true;
                } else if ("--analyze".equals(arg)) {
                    analyze = true;
                } else if (arg.startsWith("--depth=")) {
                    config = config.withDepth(Integer.parseInt(arg.substring("--depth=".length())));
                } else {
                    throw new IllegalArgumentException("Unrecognised argument: " + arg);
                }
            }
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
            printUsage();
            return;
        }

        AlphaBetaAI opponent = new AlphaBetaAI(config);
        AlphaBetaAI assistant = new AlphaBetaAI(config.withDepth(config.depth() + 2));
        MoveAnalyzer analyzer = analyze ? new MoveAnalyzer(assistant) : null;
        play(new Scanner(System.in), new GameState(new Board(rules)), opponent, assistant,
                analyzer, selfPlay);
    }

    private static void play(Scanner scanner, GameState initial, AlphaBetaAI opponent, AlphaBetaAI assistant,
            MoveAnalyzer analyzer, boolean selfPlay) {
        GameState state = initial;
        List<MoveAnalysis> analyses = new ArrayList<>();

        System.out.println("Checkers - console edition");
        while (!state.isGameOver()) {
            Board board = state.getBoard();
            System.out.print(BoardDiagram.renderWithCoordinates(board));

            Move move;
            if (selfPlay || board.sideToMove() == PieceColor.BLACK) {
                SearchResult result = opponent.searchBestMove(board, board.sideToMove());
                move = result.move();
                System.out.printf(Locale.ROOT, "%s plays %s (score %d, %d nodes, %.2f cutoffs/node)%n",
                        board.sideToMove(), move, result.score(), result.visitedNodes(),
                        result.statistics().pruningRatio());
            } else {
                move = readHumanMove(scanner, board, assistant);
                if (move == null) {
                    state = state.resign();
                    System.out.printf("%s resigns.%n", board.sideToMove());
                    break;
                }
            }

            if (analyzer != null) {
                analyses.add(analyzer.analyze(board, move, state.getMoveNumber() + 1));
            }
            state = state.applyMove(move);
        }

        System.out.print(BoardDiagram.renderWithCoordinates(state.getBoard()));
        GameStatus status = state.status();
        if (status.kind() == GameStatus.Kind.WON) {
            System.out.printf("Winner: %s after %d plies%n", status.winner(), state.getMoveNumber());
        } else {
            System.out.printf("Draw after %d plies%n", state.getMoveNumber());
        }
        if (analyzer != null) {
            System.out.println(MoveAnalyzer.report(analyses));
        }
    }

    private static Move readHumanMove(Scanner scanner, Board board, AlphaBetaAI assistant) {
        List<Move> moves = board.legalMoves();
        while (true) {
            System.out.println("Legal moves:");
            for (int i = 0; i < moves.size(); i++) {
                System.out.printf("  %d) %s%n", i + 1, moves.get(i));
            }
            System.out.printf("%s to move (number, move such as c3-d4, 'hint' or 'resign'): ", board.sideToMove());
            if (!scanner.hasNextLine()) {
                return null;
            }
            String input = scanner.nextLine().trim().toLowerCase(Locale.ROOT);
            if ("quit".equals(input) || "resign".equals(input)) {
                return null;
            }
            if ("hint".equals(input)) {
                System.out.println("Suggested: " + assistant.getBestMove(board, board.sideToMove()));
                continue;
            }
            try {
                if (input.chars().allMatch(Character::isDigit) && !input.isEmpty()) {
                    int index = Integer.parseInt(input) - 1;
                    if (index < 0 || index >= moves.size()) {
                        System.out.println("Choose a number between 1 and " + moves.size() + ".");
                        continue;
                    }
                    return moves.get(index);
                }
                return MoveNotation.parse(input, board);
            } catch (IllegalArgumentException ex) {
                System.out.println(ex.getMessage());
            }
        }
    }

    private static void configureLogging() {
        try (InputStream in = CheckersCLI.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Failed to read logging configuration", ex);
        }
    }

    private static void printUsage() {
        System.err.println("Usage: CheckersCLI [--depth=<plies>] [--selfplay] [--analyze]");
    }
}
