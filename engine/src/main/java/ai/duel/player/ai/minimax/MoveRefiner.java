package ai.duel.player.ai.minimax;

import ai.duel.game.Action;
import ai.duel.game.CardInstance;
import ai.duel.game.GuardianStar;
import ai.duel.game.Stance;
import ai.duel.game.StarChoice;
import java.util.List;

/**
 * Re-derives the stance and star of a play chosen by the search from simple local rules.
 * <p>
 * The search scores all four stance/star variants of a play, but the variant actually executed is
 * recomputed here from the card and the opponent's field card alone. The two can disagree; the
 * executed play always follows these rules.
 */
public class MoveRefiner {
    /** Attack at or above which a card goes in attack stance against an empty field. */
    public static final int OPEN_FIELD_ATTACK_THRESHOLD = 1500;

    /**
     * Refines {@code action} for the AI's hand. Non-play actions and out-of-range indices are
     * returned unchanged.
     *
     * @param opponentField the human's field card, or {@code null}
     */
    public Action refine(Action action, List<CardInstance> hand, CardInstance opponentField) {
        if (!action.isPlay() || action.handIndex() < 0 || action.handIndex() >= hand.size()) {
            return action;
        }
        CardInstance card = hand.get(action.handIndex());
        return Action.play(action.handIndex(), selectStance(card, opponentField),
                selectStar(card, opponentField), card.getName());
    }

    /**
     * The star with the strictly greater bonus against the opponent's active star; the first star
     * on a tie or when the opponent's field is empty.
     */
    public StarChoice selectStar(CardInstance card, CardInstance opponentField) {
        if (opponentField == null) {
            return StarChoice.FIRST;
        }
        GuardianStar opposing = opponentField.getActiveStar();
        int first = GuardianStar.combatBonus(card.getFirstStar(), opposing);
        int second = GuardianStar.combatBonus(card.getSecondStar(), opposing);
        return second > first ? StarChoice.SECOND : StarChoice.FIRST;
    }

    /**
     * Against an empty field: attack from {@value #OPEN_FIELD_ATTACK_THRESHOLD} attack up, defense
     * below. Otherwise attack if the card out-attacks the opponent, defense if it can block the
     * opponent's attack, and failing both the card's larger stat (attack on a tie).
     */
    public Stance selectStance(CardInstance card, CardInstance opponentField) {
        if (opponentField == null) {
            return card.getAttack() >= OPEN_FIELD_ATTACK_THRESHOLD ? Stance.ATTACK : Stance.DEFENSE;
        }
        int opponentAttack = opponentField.getAttack();
        if (card.getAttack() > opponentAttack) {
            return Stance.ATTACK;
        }
        if (card.getDefense() >= opponentAttack) {
            return Stance.DEFENSE;
        }
        return card.getDefense() > card.getAttack() ? Stance.DEFENSE : Stance.ATTACK;
    }
}
