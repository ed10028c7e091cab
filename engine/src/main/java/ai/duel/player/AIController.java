package ai.duel.player;

import ai.duel.game.Action;
import ai.duel.game.CardInstance;
import ai.duel.game.MatchState;
import java.util.Optional;

/**
 * Base class for computer seats. Subclasses choose a structured {@link Action}; this class turns it
 * into a console command.
 */
public abstract class AIController implements Controller {

    @Override
    public String nextCommand(MatchState state, String moves, String feedback) {
        return chooseAction(state).map(Action::toCommandString).orElse("pass");
    }

    /**
     * Chooses the AI's next action, or empty when there is nothing worth doing.
     */
    public abstract Optional<Action> chooseAction(MatchState state);

    protected CardInstance opponentField(MatchState state) {
        return state.getHuman().getField().orElse(null);
    }
}
