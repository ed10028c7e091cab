package ai.duel.unit.game;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.duel.catalog.CardCatalog;
import ai.duel.catalog.CardCatalogLoader;
import ai.duel.game.CardInstance;
import ai.duel.game.DeckDealer;
import ai.duel.game.MatchRules;
import ai.duel.game.MatchState;
import ai.duel.game.Phase;
import ai.duel.game.Player;
import ai.duel.game.Side;
import ai.duel.unit.helpers.TestCatalog;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class DeckDealerTest {

    private static CardCatalog bundled;

    @BeforeAll
    static void loadCatalog() {
        bundled = new CardCatalogLoader().loadFromClasspath("catalog/monsters.json", "catalog/fusions.json");
    }

    private static int cardCount(Player player) {
        return player.getDeck().size() + player.getHand().size() + (player.hasFieldCard() ? 1 : 0);
    }

    private static List<String> names(Player player) {
        List<String> names = new ArrayList<>();
        player.getHand().forEach(card -> names.add(card.getName()));
        player.getDeck().forEach(card -> names.add(card.getName()));
        return names;
    }

    @Test
    void standardDealGivesTwentyCardsAndFiveInHand() {
        MatchState state = new DeckDealer(bundled, MatchRules.standard(), new Random(7)).deal();

        for (Player player : List.of(state.getHuman(), state.getAi())) {
            assertEquals(5, player.getHand().size());
            assertEquals(15, player.getDeck().size());
            assertFalse(player.hasFieldCard());
            assertEquals(8000, player.getLifePoints());
        }
        assertEquals(Side.HUMAN, state.getCurrentSide());
        assertEquals(Phase.MAIN, state.getPhase());
        assertEquals(1, state.getTurnNumber());
        assertEquals(DeckDealer.DEFAULT_HUMAN_NAME, state.getHuman().getName());
        assertTrue(state.getAi().isAiControlled());
    }

    @Test
    void largeCatalogDealsDistinctCards() {
        MatchState state = new DeckDealer(bundled, MatchRules.standard(), new Random(11)).deal();

        List<String> all = new ArrayList<>(names(state.getHuman()));
        all.addAll(names(state.getAi()));

        assertEquals(40, all.size());
        assertEquals(40, all.stream().distinct().count());
    }

    @Test
    void sameSeedDealsTheSameMatch() {
        MatchState first = new DeckDealer(bundled, MatchRules.standard(), new Random(42)).deal("Ann", "Bot");
        MatchState second = new DeckDealer(bundled, MatchRules.standard(), new Random(42)).deal("Ann", "Bot");

        assertEquals(names(first.getHuman()), names(second.getHuman()));
        assertEquals(names(first.getAi()), names(second.getAi()));
        assertEquals("Ann", first.getHuman().getName());
        assertEquals("Bot", first.getAi().getName());
    }

    @Test
    void smallCatalogIsDoubledToFillBothDecks() {
        // Ten cards with the minimum deck size of ten: the pool is doubled to twenty.
        MatchRules rules = MatchRules.standard().withDeckSize(10);

        MatchState state = new DeckDealer(TestCatalog.catalog(), rules, new Random(3)).deal();

        assertEquals(10, cardCount(state.getHuman()));
        assertEquals(10, cardCount(state.getAi()));
    }

    @Test
    void oversizedDeckIsClampedToThePool() {
        // Forty per deck from a doubled pool of twenty: the human takes all, the AI gets nothing.
        MatchRules rules = new MatchRules(8000, 5, 5, 40);

        MatchState state = new DeckDealer(TestCatalog.catalog(), rules, new Random(5)).deal();

        assertEquals(20, cardCount(state.getHuman()));
        assertEquals(0, cardCount(state.getAi()));
        assertTrue(state.getAi().getHand().isEmpty());
    }

    @Test
    void deckSizeIsClampedByTheRules() {
        assertEquals(MatchRules.MIN_DECK_SIZE, MatchRules.standard().withDeckSize(3).deckSize());
        assertEquals(MatchRules.MAX_DECK_SIZE, MatchRules.standard().withDeckSize(400).deckSize());
    }

    @Test
    void dealtCardsStartInAttackUnderTheFirstStar() {
        MatchState state = new DeckDealer(bundled, MatchRules.standard(), new Random(1)).deal();

        for (CardInstance card : state.getHuman().getHand()) {
            assertEquals(card.getFirstStar(), card.getActiveStar());
        }
    }
}
