package ai.duel.unit.game;

import static ai.duel.unit.helpers.TestCatalog.COPPER_GOLEM;
import static ai.duel.unit.helpers.TestCatalog.EMBER_PUP;
import static ai.duel.unit.helpers.TestCatalog.LEAF_SPRITE;
import static ai.duel.unit.helpers.TestCatalog.MOON_FIEND;
import static ai.duel.unit.helpers.TestCatalog.SPARK_IMP;
import static ai.duel.unit.helpers.TestCatalog.STONE_WALL;
import static ai.duel.unit.helpers.TestCatalog.STORM_ENGINE;
import static ai.duel.unit.helpers.TestCatalog.SUN_KNIGHT;
import static ai.duel.unit.helpers.TestCatalog.TIDE_RAIDER;
import static ai.duel.unit.helpers.TestCatalog.WILDFIRE_WOLF;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.duel.game.CardInstance;
import ai.duel.game.Combination;
import ai.duel.game.GuardianStar;
import ai.duel.game.MatchRules;
import ai.duel.game.Player;
import ai.duel.game.Stance;
import ai.duel.game.StarChoice;
import ai.duel.unit.helpers.TestCatalog;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/**
 * Player zone operations: draw bound, play and undo, fusion checks and execution.
 *
 * <p><b>Tests and their intentions:</b>
 * <ul>
 *   <li><b>drawNeverExceedsHandLimit</b> - repeated draws stop at the hand bound</li>
 *   <li><b>drawFromEmptyDeckFails</b> - empty deck returns nothing</li>
 *   <li><b>playReplacesFieldAndUndoRestoresIt</b> - sacrifice goes to graveyard and comes back on undo</li>
 *   <li><b>undoWithoutSacrificeOnlyReturnsCard</b> - first play of a match has nothing to restore</li>
 *   <li><b>undoIgnoresSacrificeBuriedUnderAnotherCard</b> - identity check against the graveyard top</li>
 *   <li><b>combineRejectsBadIndices</b> - equal or out-of-range indices leave every zone untouched</li>
 *   <li><b>combineMatchesRecipeInEitherOrder</b> - recipe stored (Y, X) matches X,Y and Y,X</li>
 * </ul>
 */
class PlayerTest {

    private static Player newPlayer() {
        return new Player("Tester", false, TestCatalog.catalog(), MatchRules.standard());
    }

    private static List<CardInstance> instances(String... names) {
        List<CardInstance> cards = new ArrayList<>();
        for (String name : names) {
            cards.add(new CardInstance(TestCatalog.card(name)));
        }
        return cards;
    }

    @Test
    void drawNeverExceedsHandLimit() {
        Player player = newPlayer();
        player.addToDeck(instances(SUN_KNIGHT, MOON_FIEND, STONE_WALL, TIDE_RAIDER, EMBER_PUP, LEAF_SPRITE, SPARK_IMP));

        for (int i = 0; i < 10; i++) {
            player.draw();
            assertTrue(player.getHand().size() <= player.getHandLimit());
        }
        assertEquals(5, player.getHand().size());
        assertEquals(2, player.getDeck().size());
        assertTrue(player.draw().isEmpty());
    }

    @Test
    void drawTakesFromTheFrontOfTheDeck() {
        Player player = newPlayer();
        player.addToDeck(instances(SUN_KNIGHT, MOON_FIEND));

        Optional<CardInstance> drawn = player.draw();

        assertTrue(drawn.isPresent());
        assertEquals(SUN_KNIGHT, drawn.get().getName());
        assertEquals(MOON_FIEND, player.peekDeck().orElseThrow().getName());
    }

    @Test
    void drawFromEmptyDeckFails() {
        assertTrue(newPlayer().draw().isEmpty());
    }

    @Test
    void playSetsStanceAndStar() {
        Player player = newPlayer();
        player.addToHand(new CardInstance(TestCatalog.card(SUN_KNIGHT)));

        assertTrue(player.playToField(0, Stance.DEFENSE, StarChoice.SECOND));

        CardInstance field = player.getField().orElseThrow();
        assertEquals(Stance.DEFENSE, field.getStance());
        assertEquals(GuardianStar.MERCURY, field.getActiveStar());
        assertTrue(player.getHand().isEmpty());
    }

    @Test
    void playWithBadIndexFails() {
        Player player = newPlayer();
        player.addToHand(new CardInstance(TestCatalog.card(SUN_KNIGHT)));

        assertFalse(player.playToField(1, Stance.ATTACK, StarChoice.FIRST));
        assertFalse(player.playToField(-1, Stance.ATTACK, StarChoice.FIRST));
        assertFalse(player.hasFieldCard());
        assertEquals(1, player.getHand().size());
    }

    @Test
    void playReplacesFieldAndUndoRestoresIt() {
        Player player = newPlayer();
        CardInstance old = new CardInstance(TestCatalog.card(STONE_WALL));
        player.placeOnField(old);
        player.addToHand(new CardInstance(TestCatalog.card(SUN_KNIGHT)));

        assertTrue(player.playToField(0, Stance.ATTACK, StarChoice.FIRST));
        assertEquals(SUN_KNIGHT, player.getField().orElseThrow().getName());
        assertSame(old, player.getGraveyard().get(0));
        assertSame(old, player.getLastSacrificed().orElseThrow());

        assertTrue(player.undoLastPlay());
        assertSame(old, player.getField().orElseThrow());
        assertTrue(player.getGraveyard().isEmpty());
        assertEquals(SUN_KNIGHT, player.getHand().get(0).getName());
        assertTrue(player.getLastSacrificed().isEmpty());
    }

    @Test
    void undoWithoutSacrificeOnlyReturnsCard() {
        Player player = newPlayer();
        player.addToHand(new CardInstance(TestCatalog.card(SUN_KNIGHT)));
        player.playToField(0, Stance.ATTACK, StarChoice.FIRST);

        assertTrue(player.undoLastPlay());
        assertFalse(player.hasFieldCard());
        assertEquals(1, player.getHand().size());
        assertFalse(player.undoLastPlay());
    }

    @Test
    void playClearsStaleSacrificeRecord() {
        Player player = newPlayer();
        player.placeOnField(new CardInstance(TestCatalog.card(STONE_WALL)));
        player.addToHand(new CardInstance(TestCatalog.card(SUN_KNIGHT)));
        player.addToHand(new CardInstance(TestCatalog.card(MOON_FIEND)));
        player.playToField(0, Stance.ATTACK, StarChoice.FIRST);
        player.undoLastPlay();
        player.undoLastPlay();
        // Field is empty now; a new play has nothing to sacrifice.
        player.playToField(0, Stance.ATTACK, StarChoice.FIRST);

        assertTrue(player.getLastSacrificed().isEmpty());
    }

    @Test
    void undoIgnoresSacrificeBuriedUnderAnotherCard() {
        Player player = newPlayer();
        player.placeOnField(new CardInstance(TestCatalog.card(STONE_WALL)));
        player.addToHand(new CardInstance(TestCatalog.card(EMBER_PUP)));
        player.addToHand(new CardInstance(TestCatalog.card(LEAF_SPRITE)));
        player.addToHand(new CardInstance(TestCatalog.card(SUN_KNIGHT)));

        player.playToField(2, Stance.ATTACK, StarChoice.FIRST);
        // Fusion materials land on top of the sacrificed card.
        assertTrue(player.combine(0, 1).isPresent());

        assertTrue(player.undoLastPlay());
        assertFalse(player.hasFieldCard());
        assertEquals(3, player.getGraveyard().size());
    }

    @Test
    void combineRejectsBadIndices() {
        Player player = newPlayer();
        player.addToHand(new CardInstance(TestCatalog.card(EMBER_PUP)));
        player.addToHand(new CardInstance(TestCatalog.card(LEAF_SPRITE)));

        assertTrue(player.combine(0, 0).isEmpty());
        assertTrue(player.combine(0, 2).isEmpty());
        assertTrue(player.combine(-1, 1).isEmpty());
        assertTrue(player.canCombine(5, 1).isEmpty());

        assertEquals(2, player.getHand().size());
        assertTrue(player.getGraveyard().isEmpty());
        assertFalse(player.hasFieldCard());
    }

    @Test
    void combineRejectsPairWithoutRecipe() {
        Player player = newPlayer();
        player.addToHand(new CardInstance(TestCatalog.card(SUN_KNIGHT)));
        player.addToHand(new CardInstance(TestCatalog.card(MOON_FIEND)));

        assertTrue(player.combine(0, 1).isEmpty());
        assertEquals(2, player.getHand().size());
    }

    @Test
    void combineMatchesRecipeInEitherOrder() {
        // The recipe is registered as (Leaf Sprite, Ember Pup).
        Player forward = newPlayer();
        forward.addToHand(new CardInstance(TestCatalog.card(EMBER_PUP)));
        forward.addToHand(new CardInstance(TestCatalog.card(LEAF_SPRITE)));
        Player reversed = newPlayer();
        reversed.addToHand(new CardInstance(TestCatalog.card(LEAF_SPRITE)));
        reversed.addToHand(new CardInstance(TestCatalog.card(EMBER_PUP)));

        assertEquals(WILDFIRE_WOLF, forward.canCombine(0, 1).orElseThrow().getName());
        assertEquals(WILDFIRE_WOLF, reversed.canCombine(0, 1).orElseThrow().getName());
        assertEquals(WILDFIRE_WOLF, reversed.canCombine(1, 0).orElseThrow().getName());
    }

    @Test
    void combineMovesMaterialsToGraveyardAndAppendsResult() {
        Player player = newPlayer();
        player.addToHand(new CardInstance(TestCatalog.card(COPPER_GOLEM)));
        player.addToHand(new CardInstance(TestCatalog.card(SUN_KNIGHT)));
        player.addToHand(new CardInstance(TestCatalog.card(SPARK_IMP)));

        CardInstance result = player.combine(2, 0).orElseThrow();

        assertEquals(STORM_ENGINE, result.getName());
        assertEquals(9001, result.getCard().getId());
        assertEquals(7, result.getCard().getLevel());
        assertEquals(List.of(SUN_KNIGHT, STORM_ENGINE), player.getHand().stream().map(CardInstance::getName).toList());
        // Higher index is removed first.
        assertEquals(List.of(SPARK_IMP, COPPER_GOLEM), player.getGraveyard().stream().map(CardInstance::getName).toList());
    }

    @Test
    void possibleCombinationsScansPairsInIndexOrder() {
        Player player = newPlayer();
        player.addToHand(new CardInstance(TestCatalog.card(SPARK_IMP)));
        player.addToHand(new CardInstance(TestCatalog.card(EMBER_PUP)));
        player.addToHand(new CardInstance(TestCatalog.card(COPPER_GOLEM)));
        player.addToHand(new CardInstance(TestCatalog.card(LEAF_SPRITE)));

        List<Combination> combinations = player.possibleCombinations();

        assertEquals(2, combinations.size());
        assertEquals(0, combinations.get(0).first());
        assertEquals(2, combinations.get(0).second());
        assertEquals(STORM_ENGINE, combinations.get(0).result().getName());
        assertEquals(1, combinations.get(1).first());
        assertEquals(3, combinations.get(1).second());
        assertEquals(WILDFIRE_WOLF, combinations.get(1).result().getName());
    }

    @Test
    void outOfCardsNeedsEmptyDeckHandAndField() {
        Player player = newPlayer();
        assertTrue(player.isOutOfCards());

        player.placeOnField(new CardInstance(TestCatalog.card(SUN_KNIGHT)));
        assertFalse(player.isOutOfCards());
    }
}
