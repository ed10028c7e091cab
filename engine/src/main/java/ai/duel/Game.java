package ai.duel;

import ai.duel.catalog.CardCatalog;
import ai.duel.config.DuelProperties;
import ai.duel.config.GuidanceModeProperties;
import ai.duel.config.TrainingModeProperties;
import ai.duel.game.Action;
import ai.duel.game.BattleResult;
import ai.duel.game.BoardFormatter;
import ai.duel.game.DeckDealer;
import ai.duel.game.MatchState;
import ai.duel.game.Player;
import ai.duel.game.Side;
import ai.duel.player.AIController;
import ai.duel.player.Controller;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Game implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(Game.class);

    /** Failed commands tolerated from one seat in one main phase before it is forced to move. */
    private static final int MAX_FAILED_COMMANDS = 20;

    private final Controller humanSeat;
    private final Controller aiSeat;
    private final CardCatalog catalog;
    private final DuelProperties duelProperties;
    private final TrainingModeProperties trainingMode;
    private final GuidanceModeProperties guidanceMode;

    public Game(@Qualifier("humanSeat") Controller humanSeat,
                @Qualifier("aiSeat") Controller aiSeat,
                CardCatalog catalog,
                DuelProperties duelProperties,
                TrainingModeProperties trainingMode,
                GuidanceModeProperties guidanceMode) {
        this.humanSeat = humanSeat;
        this.aiSeat = aiSeat;
        this.catalog = catalog;
        this.duelProperties = duelProperties;
        this.trainingMode = trainingMode;
        this.guidanceMode = guidanceMode;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Game.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        // CLI entrypoint ignores the result; tests call play() directly.
        play();
    }

    /**
     * Deals a fresh match from the catalog and plays it to the end.
     */
    public GameResult play() {
        Random random = duelProperties.getSeed() != null ? new Random(duelProperties.getSeed()) : new Random();
        MatchState state = new DeckDealer(catalog, duelProperties.toRules(), random)
                .deal(duelProperties.getHumanName(), duelProperties.getAiName());
        return play(state);
    }

    /**
     * Core game loop used by both the CLI runner and automated tests.
     *
     * <p>Each turn runs in three phases:
     * <ol>
     *     <li>Main phase: the current seat issues commands until it plays a card or passes.
     *     Fusions do not end the phase. In training mode the human's play is provisional until
     *     confirmed with {@code pass}.</li>
     *     <li>Battle: if both fields are occupied, the current side attacks.</li>
     *     <li>Turn advancement: control passes to the other side, which draws.</li>
     * </ol>
     * The loop stops on game over, on {@code quit} or closed input, or once the turn cap is passed.
     *
     * @return the winner (if any), how far the match got and how long it took
     */
    public GameResult play(MatchState state) {
        long startNanos = System.nanoTime();
        int maxTurns = duelProperties.getMaxTurns();
        LoopCounters counters = new LoopCounters();
        boolean aborted = false;

        state.checkGameOver();
        while (!state.isGameOver()) {
            if (state.getTurnNumber() > maxTurns) {
                log.info("Turn limit {} reached; stopping the match without a winner.", maxTurns);
                aborted = true;
                break;
            }
            Side side = state.getCurrentSide();
            if (!playMainPhase(state, side, counters)) {
                aborted = true;
                break;
            }
            if (state.isGameOver()) {
                break;
            }
            Optional<BattleResult> battle = state.resolveBattle(side);
            battle.ifPresent(result -> log.info("Battle: {}", result.description()));
            if (!state.isGameOver()) {
                state.nextTurn();
            }
        }

        long durationNanos = System.nanoTime() - startNanos;
        log.info("{}", new BoardFormatter(state).format());
        if (state.isGameOver()) {
            log.info("{}", state.getWinner()
                    .map(side -> state.player(side).getName() + " wins on turn " + state.getTurnNumber() + ".")
                    .orElse("The match ended in a draw."));
        }
        GameResult result = new GameResult(state.getWinner().orElse(null), state.getTurnNumber(),
                counters.appliedActions, aborted, durationNanos);
        if (EpisodeLogger.isEnabled()) {
            EpisodeLogger.logSummary(result);
        }
        return result;
    }

    /**
     * Runs one seat's main phase.
     *
     * @return {@code false} if the seat quit or its input closed
     */
    private boolean playMainPhase(MatchState state, Side side, LoopCounters counters) {
        Controller controller = side == Side.HUMAN ? humanSeat : aiSeat;
        boolean aiMode = controller instanceof AIController;
        boolean provisional = trainingMode.isMode() && side == Side.HUMAN;
        Player player = state.player(side);
        boolean pendingPlay = false;
        int failures = 0;
        String feedback = "";

        while (true) {
            List<Action> legal = state.legalActions(side);
            printTurn(state, aiMode);
            String moves = guidanceMode.isMode() && !aiMode ? BoardFormatter.formatActions(legal) : "";

            String input = controller.nextCommand(state, moves, feedback);
            if (input == null) {
                if (log.isDebugEnabled()) {
                    log.debug("Input closed. Exiting for seat {}", side);
                }
                return false;
            }
            // Normalise basic formatting artefacts (e.g. a copied bullet "- pass").
            input = input.trim();
            if (input.startsWith("- ")) {
                input = input.substring(2).trim();
            }
            String lower = input.toLowerCase(Locale.ROOT);
            if (aiMode && log.isDebugEnabled()) {
                log.debug("AI command: {}", input);
            }

            if ("quit".equals(lower)) {
                return false;
            }
            if ("undo".equals(lower)) {
                if (provisional && pendingPlay && player.undoLastPlay()) {
                    pendingPlay = false;
                    feedback = "Play undone.";
                } else {
                    feedback = provisional ? "Nothing to undo." : "Undo is only available in training mode.";
                }
                continue;
            }

            Action action = Action.tryParse(input);
            if (action == null || (action.isPass() && !legal.contains(action))) {
                feedback = action == null
                        ? "Unrecognised command: " + input
                        : "You must play a card while your field is empty.";
                if (++failures > MAX_FAILED_COMMANDS) {
                    action = legal.get(0);
                    log.warn("Seat {} failed {} commands; forcing {}", side, failures - 1, action);
                } else {
                    continue;
                }
            }
            if (EpisodeLogger.isEnabled()) {
                EpisodeLogger.logStep(state, side, counters.steps, legal, action.toCommandString());
            }
            counters.steps++;

            if (!state.applyAction(side, action)) {
                feedback = "Illegal action: " + action;
                if (++failures > MAX_FAILED_COMMANDS) {
                    Action fallback = legal.get(0);
                    log.warn("Seat {} failed {} commands; forcing {}", side, failures - 1, fallback);
                    state.applyAction(side, fallback);
                    counters.appliedActions++;
                    return true;
                }
                continue;
            }
            counters.appliedActions++;
            if (state.checkGameOver()) {
                return true;
            }

            switch (action.type()) {
                case COMBINE -> {
                    String fused = player.getHand().get(player.getHand().size() - 1).getName();
                    feedback = player.getName() + " fused " + fused + ".";
                    log.info(feedback);
                }
                case PLAY -> {
                    String played = player.getField().map(BoardFormatter::describeField).orElse("?");
                    if (provisional) {
                        pendingPlay = true;
                        feedback = "Played " + played + ". Enter 'pass' to confirm or 'undo' to take it back.";
                    } else {
                        log.info("{} plays {}", player.getName(), played);
                        return true;
                    }
                }
                case PASS -> {
                    if (pendingPlay) {
                        log.info("{} plays {}", player.getName(),
                                player.getField().map(BoardFormatter::describeField).orElse("?"));
                    } else {
                        log.info("{} keeps the current field.", player.getName());
                    }
                    return true;
                }
            }
        }
    }

    /**
     * Render the board for humans following along: at info for a human seat, at debug for the AI.
     */
    private void printTurn(MatchState state, boolean aiMode) {
        String board = new BoardFormatter(state, guidanceMode.isMode()).format();
        if (!aiMode) {
            log.info("\n{}", board);
        } else if (log.isDebugEnabled()) {
            log.debug("\n{}", board);
        }
    }

    /**
     * Mutable counters shared across the main phases of one match.
     */
    private static final class LoopCounters {
        int steps = 0;
        int appliedActions = 0;
    }
}
