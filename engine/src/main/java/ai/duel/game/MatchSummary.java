package ai.duel.game;

/**
 * Headline numbers of a match at one instant, for status lines and logs.
 *
 * @param humanField name of the human's field card, or {@code null} if empty
 * @param aiField    name of the AI's field card, or {@code null} if empty
 * @param winnerName winning player's name, or {@code null} while running or on a draw
 */
public record MatchSummary(
        int turnNumber,
        String currentPlayer,
        Phase phase,
        int humanLifePoints,
        int aiLifePoints,
        int humanHandSize,
        int aiHandSize,
        int humanDeckSize,
        int aiDeckSize,
        String humanField,
        String aiField,
        boolean gameOver,
        String winnerName) {

    public String statusLine() {
        String status = String.format("Turn %d (%s, %s) | LP %d vs %d | hand %d vs %d | deck %d vs %d",
                turnNumber, currentPlayer, phase, humanLifePoints, aiLifePoints,
                humanHandSize, aiHandSize, humanDeckSize, aiDeckSize);
        if (gameOver) {
            status += winnerName != null ? " | winner: " + winnerName : " | draw";
        }
        return status;
    }
}
