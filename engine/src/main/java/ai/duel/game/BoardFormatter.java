package ai.duel.game;

import java.util.List;

/**
 * Renders a {@link MatchState} as plain text for the console.
 * <p>
 * The AI's side is drawn on top and the human's below, each with life points, pile sizes, the
 * field card and the hand. Everything is shown because the duel is played with perfect
 * information; the next {@link MatchState#DEFAULT_LOOKAHEAD} cards of each deck are listed too when
 * requested.
 */
public class BoardFormatter {
    private static final int WIDTH = 78;

    private final MatchState state;
    private final boolean showUpcoming;

    public BoardFormatter(MatchState state) {
        this(state, false);
    }

    /**
     * @param showUpcoming whether to list the top cards of both decks
     */
    public BoardFormatter(MatchState state, boolean showUpcoming) {
        this.state = state;
        this.showUpcoming = showUpcoming;
    }

    public String format() {
        StringBuilder sb = new StringBuilder();
        String title = String.format(" Turn %d | %s | %s ", state.getTurnNumber(),
                state.getCurrentPlayer().getName(), state.getPhase());
        int pad = Math.max(0, WIDTH - title.length());
        sb.append("=".repeat(pad / 2)).append(title).append("=".repeat(pad - pad / 2)).append('\n');
        appendPlayer(sb, state.getAi());
        sb.append("-".repeat(WIDTH)).append('\n');
        appendPlayer(sb, state.getHuman());
        state.getLastBattleResult().ifPresent(result ->
                sb.append("Last battle: ").append(result.description()).append('\n'));
        if (state.isGameOver()) {
            sb.append(state.getWinner()
                    .map(side -> "Game over: " + state.player(side).getName() + " wins")
                    .orElse("Game over: draw")).append('\n');
        }
        sb.append("=".repeat(WIDTH));
        return sb.toString();
    }

    private void appendPlayer(StringBuilder sb, Player player) {
        sb.append(String.format("%-10s LP %5d | deck %2d | hand %d | graveyard %d%n",
                player.getName(), player.getLifePoints(), player.getDeck().size(),
                player.getHand().size(), player.getGraveyard().size()));
        sb.append("  Field: ").append(player.getField().map(BoardFormatter::describeField).orElse("-")).append('\n');
        List<CardInstance> hand = player.getHand();
        for (int i = 0; i < hand.size(); i++) {
            sb.append("  [").append(i).append("] ").append(hand.get(i).getCard()).append('\n');
        }
        if (showUpcoming) {
            List<CardInstance> upcoming = state.upcomingCards(player);
            if (!upcoming.isEmpty()) {
                sb.append("  Next:");
                for (CardInstance card : upcoming) {
                    sb.append(' ').append(card.getName()).append(';');
                }
                sb.setLength(sb.length() - 1);
                sb.append('\n');
            }
        }
    }

    /**
     * One-line description of a field card: definition, stance and active star.
     */
    public static String describeField(CardInstance card) {
        return card.getCard() + " " + card.getStance().getCode() + " under " + card.getActiveStar().getLabel();
    }

    /**
     * Numbered list of actions, one per line, for prompts.
     */
    public static String formatActions(List<Action> actions) {
        StringBuilder sb = new StringBuilder();
        for (Action action : actions) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append("- ").append(action.describe());
        }
        return sb.toString();
    }
}
