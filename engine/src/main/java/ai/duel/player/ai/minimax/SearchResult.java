package ai.duel.player.ai.minimax;

import ai.duel.game.Action;
import java.util.Optional;

/**
 * Value of a searched node and the action that achieves it.
 *
 * @param score  minimax value from the AI's point of view
 * @param action best action at the node, or {@code null} at a leaf
 */
public record SearchResult(double score, Action action) {

    static SearchResult leaf(double score) {
        return new SearchResult(score, null);
    }

    public Optional<Action> bestAction() {
        return Optional.ofNullable(action);
    }
}
