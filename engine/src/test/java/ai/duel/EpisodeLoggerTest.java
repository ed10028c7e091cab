package ai.duel;

import static ai.duel.unit.helpers.TestCatalog.EMBER_PUP;
import static ai.duel.unit.helpers.TestCatalog.MOON_FIEND;
import static ai.duel.unit.helpers.TestCatalog.STONE_WALL;
import static ai.duel.unit.helpers.TestCatalog.SUN_KNIGHT;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.duel.game.MatchState;
import ai.duel.game.Side;
import ai.duel.game.Stance;
import ai.duel.game.StarChoice;
import ai.duel.unit.helpers.MatchStateBuilder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

class EpisodeLoggerTest {

    @Test
    void stepCarriesBothPlayersAndTheLegalActions() {
        MatchState state = MatchStateBuilder.newMatch()
                .humanHand(SUN_KNIGHT, MOON_FIEND)
                .humanDeck(EMBER_PUP)
                .aiField(STONE_WALL, Stance.DEFENSE, StarChoice.SECOND)
                .aiLife(6500)
                .build();

        ObjectNode step = EpisodeLogger.buildStep(state, Side.HUMAN, 3, state.legalActions(Side.HUMAN), "play 1 DEF 1");

        assertEquals("step", step.get("type").asText());
        assertEquals(3, step.get("step_index").asInt());
        assertEquals(1, step.get("turn").asInt());
        assertEquals("HUMAN", step.get("side").asText());
        assertEquals("play 1 DEF 1", step.get("chosen_command").asText());

        JsonNode human = step.get("human");
        assertEquals(8000, human.get("life_points").asInt());
        assertEquals(1, human.get("deck_size").asInt());
        assertEquals(MOON_FIEND, human.get("hand").get(1).asText());
        assertTrue(human.get("field").isNull());

        JsonNode aiField = step.get("ai").get("field");
        assertEquals(6500, step.get("ai").get("life_points").asInt());
        assertEquals(STONE_WALL, aiField.get("name").asText());
        assertEquals("DEF", aiField.get("stance").asText());
        assertEquals("MARS", aiField.get("star").asText());

        JsonNode legal = step.get("legal_actions");
        assertEquals(8, legal.size());
        assertEquals("play 0 ATK 1", legal.get(0).asText());
    }
}
