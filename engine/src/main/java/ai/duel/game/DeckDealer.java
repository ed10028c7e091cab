package ai.duel.game;

import ai.duel.catalog.CardCatalog;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deals a fresh match from the catalog.
 * <p>
 * Every catalog card is materialised once and the pool is shuffled. A catalog smaller than two
 * decks is doubled (and reshuffled) before dealing. The human receives the first
 * {@link MatchRules#deckSize()} cards and the AI the next, each deck is shuffled again, and both
 * players draw their opening hands. The match then starts in the human's main phase.
 * <p>
 * All randomness comes from the supplied {@link Random}, so a seeded dealer is reproducible.
 */
public class DeckDealer {
    private static final Logger log = LoggerFactory.getLogger(DeckDealer.class);

    public static final String DEFAULT_HUMAN_NAME = "Player";
    public static final String DEFAULT_AI_NAME = "AI";

    private final CardCatalog catalog;
    private final MatchRules rules;
    private final Random random;

    public DeckDealer(CardCatalog catalog, MatchRules rules, Random random) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.rules = Objects.requireNonNull(rules, "rules");
        this.random = Objects.requireNonNull(random, "random");
    }

    public MatchState deal() {
        return deal(DEFAULT_HUMAN_NAME, DEFAULT_AI_NAME);
    }

    public MatchState deal(String humanName, String aiName) {
        int deckSize = rules.deckSize();
        List<Card> pool = new ArrayList<>(catalog.cards());
        Collections.shuffle(pool, random);
        if (pool.size() < deckSize * 2) {
            pool.addAll(new ArrayList<>(pool));
            Collections.shuffle(pool, random);
        }

        MatchState state = new MatchState(catalog, rules, humanName, aiName);
        state.getHuman().addToDeck(instantiate(pool, 0, deckSize));
        state.getAi().addToDeck(instantiate(pool, deckSize, deckSize * 2));

        for (int i = 0; i < rules.openingHandSize(); i++) {
            state.getHuman().draw();
            state.getAi().draw();
        }
        state.setCurrentSide(Side.HUMAN);
        state.setPhase(Phase.MAIN);
        log.debug("Dealt {} cards to {} and {} cards to {} from a pool of {}",
                state.getHuman().getDeck().size() + state.getHuman().getHand().size(), humanName,
                state.getAi().getDeck().size() + state.getAi().getHand().size(), aiName, pool.size());
        return state;
    }

    private List<CardInstance> instantiate(List<Card> pool, int from, int to) {
        int start = Math.min(from, pool.size());
        int end = Math.min(to, pool.size());
        List<CardInstance> deck = new ArrayList<>();
        for (Card card : pool.subList(start, end)) {
            deck.add(new CardInstance(card));
        }
        Collections.shuffle(deck, random);
        return deck;
    }
}
