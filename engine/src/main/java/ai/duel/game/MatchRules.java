package ai.duel.game;

/**
 * Fixed numbers of a duel.
 *
 * @param startingLifePoints life each player starts with
 * @param handLimit          maximum cards in hand
 * @param openingHandSize    cards drawn by each player at setup
 * @param deckSize           cards dealt to each deck; clamped to [{@value #MIN_DECK_SIZE}, {@value #MAX_DECK_SIZE}]
 */
public record MatchRules(int startingLifePoints, int handLimit, int openingHandSize, int deckSize) {
    public static final int DEFAULT_LIFE_POINTS = 8000;
    public static final int DEFAULT_HAND_LIMIT = 5;
    public static final int DEFAULT_DECK_SIZE = 20;
    public static final int MIN_DECK_SIZE = 10;
    public static final int MAX_DECK_SIZE = 40;

    public MatchRules {
        if (handLimit < 1) {
            throw new IllegalArgumentException("handLimit must be at least 1");
        }
        if (openingHandSize < 0 || openingHandSize > handLimit) {
            throw new IllegalArgumentException("openingHandSize must be between 0 and handLimit");
        }
        deckSize = Math.max(MIN_DECK_SIZE, Math.min(deckSize, MAX_DECK_SIZE));
    }

    /**
     * 8000 life, 5-card hands and 20-card decks.
     */
    public static MatchRules standard() {
        return new MatchRules(DEFAULT_LIFE_POINTS, DEFAULT_HAND_LIMIT, DEFAULT_HAND_LIMIT, DEFAULT_DECK_SIZE);
    }

    public MatchRules withDeckSize(int size) {
        return new MatchRules(startingLifePoints, handLimit, openingHandSize, size);
    }
}
