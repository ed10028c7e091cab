package ai.duel.player.ai.minimax;

/**
 * Tunable weights of {@link StateEvaluator}. Positive scores favour the AI.
 *
 * @param winScore              magnitude returned for a decided game
 * @param lifeDifference        per life point of AI minus human
 * @param fieldAttack           fraction of a lone field card's attack
 * @param confrontationMargin   fraction of the prospective battle margin
 * @param attackStanceSwing     flat bonus or penalty when the projected loser is in attack stance
 * @param handPower             per point of summed max(attack, defense) in hand
 * @param bestAttack            per point of the best attack in hand
 * @param handSize              per card of hand size difference
 * @param deckSize              per card of deck size difference
 * @param fusionPotential       per unit of fusion potential difference
 * @param nextDraw              per point of max(attack, defense) of the next draw
 * @param lowLifeThreshold      life total below which urgency applies
 * @param lowLifeUrgency        per life point below the threshold
 */
public record EvaluationWeights(
        double winScore,
        double lifeDifference,
        double fieldAttack,
        double confrontationMargin,
        double attackStanceSwing,
        double handPower,
        double bestAttack,
        double handSize,
        double deckSize,
        double fusionPotential,
        double nextDraw,
        int lowLifeThreshold,
        double lowLifeUrgency) {

    public static final double DEFAULT_WIN_SCORE = 100_000;

    public static EvaluationWeights defaults() {
        return new EvaluationWeights(DEFAULT_WIN_SCORE, 1.5, 0.3, 0.5, 200, 0.1, 0.15, 75, 25, 150, 0.05, 2000, 0.5);
    }
}
