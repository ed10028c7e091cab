package ai.duel.unit.catalog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.duel.catalog.CardCatalog;
import ai.duel.catalog.FusionRecipe;
import ai.duel.game.Attribute;
import ai.duel.game.Card;
import ai.duel.game.MonsterType;
import ai.duel.unit.helpers.TestCatalog;
import java.util.List;
import org.junit.jupiter.api.Test;

class CardCatalogTest {

    @Test
    void lookupByNameIgnoresCaseAndSurroundingSpace() {
        CardCatalog catalog = TestCatalog.catalog();

        assertEquals(1, catalog.findByName("  sun KNIGHT ").orElseThrow().getId());
        assertTrue(catalog.findByName("Unknown").isEmpty());
        assertTrue(catalog.findByName(null).isEmpty());
    }

    @Test
    void lookupById() {
        CardCatalog catalog = TestCatalog.catalog();

        assertEquals(TestCatalog.STONE_WALL, catalog.findById(3).orElseThrow().getName());
        assertTrue(catalog.findById(99).isEmpty());
        assertEquals(10, catalog.size());
    }

    @Test
    void fusionResultsGetIdsFromTheirRecipeIndex() {
        CardCatalog catalog = TestCatalog.catalog();

        Card wolf = catalog.fuse(TestCatalog.EMBER_PUP, TestCatalog.LEAF_SPRITE).orElseThrow();
        Card wyrm = catalog.fuse(TestCatalog.YOUNG_DRAGON, TestCatalog.OLD_DRAGON).orElseThrow();

        assertEquals(CardCatalog.FUSION_ID_BASE, wolf.getId());
        assertEquals(CardCatalog.FUSION_ID_BASE + 2, wyrm.getId());
        assertEquals(1900, wolf.getAttack());
        assertEquals(FusionRecipe.RESULT_LEVEL, wyrm.getLevel());
        assertEquals(MonsterType.BEAST, wolf.getType());
    }

    @Test
    void unmatchedPairsDoNotFuse() {
        CardCatalog catalog = TestCatalog.catalog();

        assertTrue(catalog.fuse(TestCatalog.SUN_KNIGHT, TestCatalog.MOON_FIEND).isEmpty());
        assertTrue(catalog.fuse(TestCatalog.EMBER_PUP, TestCatalog.EMBER_PUP).isEmpty());
        assertTrue(catalog.fuse((String) null, TestCatalog.EMBER_PUP).isEmpty());
    }

    @Test
    void firstMatchingRecipeWins() {
        Card a = new Card(1, "Alpha", MonsterType.WARRIOR, 1000, 1000, Attribute.LIGHT, 4);
        Card b = new Card(2, "Beta", MonsterType.WARRIOR, 1000, 1000, Attribute.DARK, 4);
        CardCatalog catalog = new CardCatalog(List.of(a, b), List.of(
                new FusionRecipe("Alpha", "Beta", "First Result", 2000, 1000, Attribute.LIGHT, MonsterType.WARRIOR),
                new FusionRecipe("Beta", "Alpha", "Second Result", 3000, 1000, Attribute.DARK, MonsterType.WARRIOR)));

        assertEquals("First Result", catalog.fuse(b, a).orElseThrow().getName());
        assertEquals(2, catalog.recipes().size());
    }

    @Test
    void recipesMatchInEitherOrderIgnoringCase() {
        FusionRecipe recipe = new FusionRecipe("Alpha", "Beta", "Gamma", 2000, 1000, Attribute.LIGHT, MonsterType.WARRIOR);

        assertTrue(recipe.matches("beta", "ALPHA"));
        assertTrue(recipe.matches("Alpha", "Beta"));
        assertTrue(!recipe.matches("Alpha", "Alpha"));
    }

    @Test
    void cardListIsReadOnly() {
        CardCatalog catalog = TestCatalog.catalog();

        assertThrows(UnsupportedOperationException.class, () -> catalog.cards().clear());
    }
}
