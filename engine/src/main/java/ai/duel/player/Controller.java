package ai.duel.player;

import ai.duel.game.MatchState;

/**
 * Represents a seat at the table capable of providing the next command for the game loop.
 */
public interface Controller {

    /**
     * Provide the next command for the game loop (e.g., "play 0 ATK 1", "fuse 1 3", "pass", "quit").
     *
     * @param state    current match state; fully visible to both seats.
     * @param moves    legal actions for this decision, rendered as a human-readable list
     *                 (empty when guidance is off).
     * @param feedback outcome of the previous command and/or error feedback.
     * @return raw command string, or null to signal the game should exit.
     */
    String nextCommand(MatchState state, String moves, String feedback);
}
