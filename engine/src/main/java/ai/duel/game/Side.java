package ai.duel.game;

/**
 * The two seats at the table. The human always moves first.
 */
public enum Side {
    HUMAN,
    AI;

    public Side opponent() {
        return this == HUMAN ? AI : HUMAN;
    }
}
