package ai.duel.game;

/**
 * Turn phases. Informational only; the rules do not depend on them.
 */
public enum Phase {
    DRAW,
    MAIN,
    BATTLE,
    END
}
