package ai.duel;

import ai.duel.game.Side;
import java.util.Optional;

/**
 * Lightweight summary of a single match.
 */
public final class GameResult {
    private final Side winner;
    private final int turns;
    private final int actions;
    private final boolean aborted;
    private final long durationNanos;

    /**
     * @param winner        winning side, or {@code null} when nobody won
     * @param turns         turn number the match ended on
     * @param actions       actions applied by both seats
     * @param aborted       whether the match stopped before a verdict (quit, closed input, turn cap)
     * @param durationNanos wall time of the match
     */
    public GameResult(Side winner, int turns, int actions, boolean aborted, long durationNanos) {
        this.winner = winner;
        this.turns = turns;
        this.actions = actions;
        this.aborted = aborted;
        this.durationNanos = durationNanos;
    }

    public Optional<Side> getWinner() {
        return Optional.ofNullable(winner);
    }

    public boolean isHumanWon() {
        return winner == Side.HUMAN;
    }

    public boolean isAiWon() {
        return winner == Side.AI;
    }

    public int getTurns() {
        return turns;
    }

    public int getActions() {
        return actions;
    }

    public boolean isAborted() {
        return aborted;
    }

    public long getDurationNanos() {
        return durationNanos;
    }

    @Override
    public String toString() {
        return "GameResult(winner=" + (winner != null ? winner : "none") + ", turns=" + turns
                + ", actions=" + actions + (aborted ? ", aborted" : "") + ")";
    }
}
