package ai.duel.unit.game;

import static ai.duel.unit.helpers.TestCatalog.EMBER_PUP;
import static ai.duel.unit.helpers.TestCatalog.MOON_FIEND;
import static ai.duel.unit.helpers.TestCatalog.STONE_WALL;
import static ai.duel.unit.helpers.TestCatalog.SUN_KNIGHT;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.duel.game.Action;
import ai.duel.game.BoardFormatter;
import ai.duel.game.MatchState;
import ai.duel.game.Side;
import ai.duel.game.Stance;
import ai.duel.game.StarChoice;
import ai.duel.unit.helpers.MatchStateBuilder;
import java.util.List;
import org.junit.jupiter.api.Test;

class BoardFormatterTest {

    private static MatchState state() {
        return MatchStateBuilder.newMatch()
                .humanHand(SUN_KNIGHT, EMBER_PUP)
                .humanDeck(STONE_WALL, MOON_FIEND)
                .aiField(MOON_FIEND, Stance.DEFENSE, StarChoice.SECOND)
                .aiHand(STONE_WALL)
                .build();
    }

    @Test
    void boardShowsBothSidesWithIndexedHand() {
        String board = new BoardFormatter(state()).format();

        assertTrue(board.contains("Turn 1 | Human | MAIN"));
        assertTrue(board.contains("Field: Moon Fiend (ATK:1500/DEF:1600) [Moon/Venus] DEF under Venus"));
        assertTrue(board.contains("[0] Sun Knight"));
        assertTrue(board.contains("[1] Ember Pup"));
        assertFalse(board.contains("Next:"));
        assertTrue(board.indexOf("\nAI ") < board.indexOf("\nHuman "));
    }

    @Test
    void upcomingCardsAreListedOnRequest() {
        String board = new BoardFormatter(state(), true).format();

        assertTrue(board.contains("Next: Stone Wall; Moon Fiend"));
    }

    @Test
    void lastBattleAndVerdictAreShown() {
        MatchState state = MatchStateBuilder.newMatch()
                .humanField(SUN_KNIGHT, Stance.ATTACK, StarChoice.FIRST)
                .aiField(MOON_FIEND, Stance.ATTACK, StarChoice.FIRST)
                .humanHand(EMBER_PUP)
                .aiLife(500)
                .build();
        state.resolveBattle(Side.HUMAN);

        String board = new BoardFormatter(state).format();

        assertTrue(board.contains("Last battle: Sun Knight (2300) destroys Moon Fiend (1000)"));
        assertTrue(board.contains("Game over: Human wins"));
    }

    @Test
    void actionsAreListedOnePerLine() {
        String listing = BoardFormatter.formatActions(List.of(
                Action.play(0, Stance.ATTACK, StarChoice.FIRST, SUN_KNIGHT), Action.pass()));

        assertEquals("- play 0 ATK 1 (Sun Knight)\n- pass", listing);
    }
}
