package ai.duel.player;

import ai.duel.config.TrainingModeProperties;
import ai.duel.game.MatchState;
import java.util.Scanner;
import org.springframework.stereotype.Component;

/**
 * Human seat that reads commands from stdin (CLI).
 */
@Component("humanSeat")
public class HumanController implements Controller {
    private final Scanner scanner = new Scanner(System.in);
    private final TrainingModeProperties trainingMode;

    public HumanController(TrainingModeProperties trainingMode) {
        this.trainingMode = trainingMode;
    }

    @Override
    public String nextCommand(MatchState state, String moves, String feedback) {
        if (feedback != null && !feedback.isBlank()) {
            System.out.println(feedback);
        }
        if (moves != null && !moves.isBlank()) {
            System.out.println("Legal actions:");
            System.out.println(moves);
        }
        System.out.print(buildPrompt(state));
        if (!scanner.hasNextLine()) {
            return null;
        }
        return scanner.nextLine();
    }

    /**
     * Builds the command prompt, including 'undo' when training mode is enabled and the human
     * has a card on the field to take back.
     */
    private String buildPrompt(MatchState state) {
        if (trainingMode.isMode() && state.getHuman().hasFieldCard()) {
            return "Enter command (play I ATK|DEF 1|2 | fuse I J | pass | undo | quit): ";
        }
        return "Enter command (play I ATK|DEF 1|2 | fuse I J | pass | quit): ";
    }
}
