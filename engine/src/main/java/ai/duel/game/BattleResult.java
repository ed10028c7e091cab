package ai.duel.game;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable record of one resolved confrontation, as appended to the battle log.
 *
 * @param attacker       side that attacked
 * @param humanCard      name of the human's field card
 * @param aiCard         name of the AI's field card
 * @param attackerValue  attacker's attack plus its star bonus
 * @param defenderValue  defender's stance stat plus its star bonus
 * @param attackerBonus  star bonus applied to the attacker
 * @param defenderBonus  star bonus applied to the defender
 * @param humanStar      human card's active star
 * @param aiStar         AI card's active star
 * @param humanStance    human card's stance
 * @param aiStance       AI card's stance
 * @param damage         life points lost by whichever side lost them (0 if none)
 * @param outcome        branch of the battle table that applied
 * @param winner         winning side, or {@code null} on a tie
 * @param description    one-line text for a presentation layer
 */
public record BattleResult(
        Side attacker,
        String humanCard,
        String aiCard,
        int attackerValue,
        int defenderValue,
        int attackerBonus,
        int defenderBonus,
        GuardianStar humanStar,
        GuardianStar aiStar,
        Stance humanStance,
        Stance aiStance,
        int damage,
        BattleOutcome outcome,
        Side winner,
        String description) {

    public BattleResult {
        Objects.requireNonNull(attacker, "attacker");
        Objects.requireNonNull(outcome, "outcome");
    }

    public Side defender() {
        return attacker.opponent();
    }

    /**
     * Value the human's card fought with, whichever role it had.
     */
    public int humanValue() {
        return attacker == Side.HUMAN ? attackerValue : defenderValue;
    }

    /**
     * Value the AI's card fought with, whichever role it had.
     */
    public int aiValue() {
        return attacker == Side.AI ? attackerValue : defenderValue;
    }

    public Stance defenderStance() {
        return attacker == Side.HUMAN ? aiStance : humanStance;
    }

    public Optional<Side> winningSide() {
        return Optional.ofNullable(winner);
    }

    public boolean isTie() {
        return winner == null;
    }
}
