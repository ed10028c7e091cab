package ai.duel.player.ai.minimax;

import ai.duel.catalog.CardCatalog;
import ai.duel.game.Card;
import ai.duel.game.CardInstance;
import ai.duel.game.MatchState;
import ai.duel.game.Player;
import ai.duel.game.Side;
import ai.duel.game.Stance;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Static evaluation of a match from the AI's point of view: positive is good for the AI.
 * <p>
 * A decided game scores {@code ±winScore} (0 for a game over without a winner). Otherwise the
 * score is a weighted sum of seven factors:
 * <ol>
 *   <li>life difference (dominant)</li>
 *   <li>field control: a lone field card, or the projected margin of the confrontation</li>
 *   <li>hand quality: summed max(attack, defense) and the best attack</li>
 *   <li>resources: hand size (heavy) and deck size (light)</li>
 *   <li>fusion potential of each hand</li>
 *   <li>the next card of each deck (perfect information)</li>
 *   <li>urgency once a life total drops below the threshold</li>
 * </ol>
 * Each factor is computed as AI minus human.
 */
public class StateEvaluator {
    private static final double FUSION_IMPROVEMENT_UNIT = 500.0;

    private final CardCatalog catalog;
    private final EvaluationWeights weights;

    public StateEvaluator(CardCatalog catalog, EvaluationWeights weights) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.weights = Objects.requireNonNull(weights, "weights");
    }

    public double evaluate(MatchState state) {
        if (state.isGameOver()) {
            Optional<Side> winner = state.getWinner();
            if (winner.isEmpty()) {
                return 0;
            }
            return winner.get() == Side.AI ? weights.winScore() : -weights.winScore();
        }

        Player ai = state.getAi();
        Player human = state.getHuman();
        double score = (ai.getLifePoints() - human.getLifePoints()) * weights.lifeDifference();
        score += fieldControl(ai.getField().orElse(null), human.getField().orElse(null));

        score += (handPower(ai.getHand()) - handPower(human.getHand())) * weights.handPower();
        score += (bestAttack(ai.getHand()) - bestAttack(human.getHand())) * weights.bestAttack();

        score += (ai.getHand().size() - human.getHand().size()) * weights.handSize();
        score += (ai.getDeck().size() - human.getDeck().size()) * weights.deckSize();

        score += (fusionPotential(ai.getHand()) - fusionPotential(human.getHand())) * weights.fusionPotential();

        score += ai.peekDeck().map(c -> c.getCard().strongestStat()).orElse(0) * weights.nextDraw();
        score -= human.peekDeck().map(c -> c.getCard().strongestStat()).orElse(0) * weights.nextDraw();

        int threshold = weights.lowLifeThreshold();
        if (ai.getLifePoints() < threshold) {
            score -= (threshold - ai.getLifePoints()) * weights.lowLifeUrgency();
        }
        if (human.getLifePoints() < threshold) {
            score += (threshold - human.getLifePoints()) * weights.lowLifeUrgency();
        }
        return score;
    }

    private double fieldControl(CardInstance aiField, CardInstance humanField) {
        if (aiField != null && humanField == null) {
            return aiField.getAttack() * weights.fieldAttack();
        }
        if (humanField != null && aiField == null) {
            return -humanField.getAttack() * weights.fieldAttack();
        }
        if (aiField == null) {
            return 0;
        }
        int aiValue = MatchState.battleValue(aiField, humanField);
        int humanValue = MatchState.battleValue(humanField, aiField);
        double term;
        if (aiValue > humanValue) {
            term = (aiValue - humanValue) * weights.confrontationMargin();
            if (humanField.getStance() == Stance.ATTACK) {
                term += weights.attackStanceSwing();
            }
        } else {
            term = -(humanValue - aiValue) * weights.confrontationMargin();
            if (aiField.getStance() == Stance.ATTACK) {
                term -= weights.attackStanceSwing();
            }
        }
        return term;
    }

    private static int handPower(List<CardInstance> hand) {
        int total = 0;
        for (CardInstance card : hand) {
            total += card.getCard().strongestStat();
        }
        return total;
    }

    private static int bestAttack(List<CardInstance> hand) {
        int best = 0;
        for (CardInstance card : hand) {
            best = Math.max(best, card.getAttack());
        }
        return best;
    }

    /**
     * Sum over every fusable pair in {@code hand} of {@code 1 + max(0, improvement) / 500}, where
     * improvement is the result's attack over the better material's attack.
     */
    double fusionPotential(List<CardInstance> hand) {
        double potential = 0;
        for (int i = 0; i < hand.size(); i++) {
            for (int j = i + 1; j < hand.size(); j++) {
                Card first = hand.get(i).getCard();
                Card second = hand.get(j).getCard();
                Optional<Card> result = catalog.fuse(first, second);
                if (result.isPresent()) {
                    int improvement = result.get().getAttack() - Math.max(first.getAttack(), second.getAttack());
                    potential += 1 + Math.max(0, improvement) / FUSION_IMPROVEMENT_UNIT;
                }
            }
        }
        return potential;
    }

    public EvaluationWeights getWeights() {
        return weights;
    }
}
