package ai.duel;

import ai.duel.game.Action;
import ai.duel.game.CardInstance;
import ai.duel.game.MatchState;
import ai.duel.game.Player;
import ai.duel.game.Side;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits structured JSON lines describing each applied action and each finished match, for offline
 * analysis of the opponent.
 *
 * <p>Lines are prefixed with "EPISODE_STEP " or "EPISODE_SUMMARY " so downstream tools can
 * filter them out of mixed logs easily. Enable with {@code -Dlog.episodes=true}.
 */
public class EpisodeLogger {
    private static final Logger log = LoggerFactory.getLogger(EpisodeLogger.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final boolean ENABLED = Boolean.getBoolean("log.episodes");

    /**
     * Return true if episode logging is enabled via -Dlog.episodes=true.
     */
    public static boolean isEnabled() {
        return ENABLED;
    }

    /**
     * Logs the position before an action, the legal actions at that point and the command chosen.
     */
    public static void logStep(MatchState stateBefore, Side side, int stepIndex, List<Action> legalActions,
                               String chosenCommand) {
        try {
            ObjectNode step = buildStep(stateBefore, side, stepIndex, legalActions, chosenCommand);
            if (log.isInfoEnabled()) {
                log.info("EPISODE_STEP {}", OBJECT_MAPPER.writeValueAsString(step));
            }
        } catch (Exception e) {
            // Logging must never interfere with gameplay.
            if (log.isDebugEnabled()) {
                log.debug("Failed to log episode step", e);
            }
        }
    }

    /**
     * Logs the outcome of a whole match.
     */
    public static void logSummary(GameResult result) {
        try {
            ObjectNode summary = OBJECT_MAPPER.createObjectNode();
            summary.put("type", "summary");
            summary.put("winner", result.getWinner().map(Enum::name).orElse(null));
            summary.put("turns", result.getTurns());
            summary.put("actions", result.getActions());
            summary.put("aborted", result.isAborted());
            summary.put("duration_nanos", result.getDurationNanos());
            if (log.isInfoEnabled()) {
                log.info("EPISODE_SUMMARY {}", OBJECT_MAPPER.writeValueAsString(summary));
            }
        } catch (Exception e) {
            if (log.isDebugEnabled()) {
                log.debug("Failed to log episode summary", e);
            }
        }
    }

    static ObjectNode buildStep(MatchState state, Side side, int stepIndex, List<Action> legalActions,
                                String chosenCommand) {
        ObjectNode step = OBJECT_MAPPER.createObjectNode();
        step.put("type", "step");
        step.put("step_index", stepIndex);
        step.put("turn", state.getTurnNumber());
        step.put("side", side.name());
        step.put("chosen_command", chosenCommand);
        step.set("human", encodePlayer(state.getHuman()));
        step.set("ai", encodePlayer(state.getAi()));
        ArrayNode legal = step.putArray("legal_actions");
        for (Action action : legalActions) {
            legal.add(action.toCommandString());
        }
        return step;
    }

    private static ObjectNode encodePlayer(Player player) {
        ObjectNode node = OBJECT_MAPPER.createObjectNode();
        node.put("life_points", player.getLifePoints());
        node.put("deck_size", player.getDeck().size());
        node.put("graveyard_size", player.getGraveyard().size());
        ArrayNode hand = node.putArray("hand");
        for (CardInstance card : player.getHand()) {
            hand.add(card.getName());
        }
        player.getField().ifPresentOrElse(card -> {
            ObjectNode field = node.putObject("field");
            field.put("name", card.getName());
            field.put("stance", card.getStance().getCode());
            field.put("star", card.getActiveStar().name());
        }, () -> node.putNull("field"));
        return node;
    }
}
