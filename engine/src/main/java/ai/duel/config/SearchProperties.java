package ai.duel.config;

import ai.duel.player.ai.Difficulty;
import ai.duel.player.ai.minimax.EvaluationWeights;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the minimax opponent ({@code search.*}).
 *
 * Usage:
 * {@code --search.depth=6 --search.weights.hand-size=90}
 */
@Component
@ConfigurationProperties(prefix = "search")
public class SearchProperties {
  private int depth = Difficulty.NORMAL.getDepth();
  private boolean pruning = true;
  private final Weights weights = new Weights();

  /**
   * Plies searched per decision; this is the difficulty knob.
   */
  public int getDepth() {
    return depth;
  }

  public void setDepth(int depth) {
    this.depth = depth;
  }

  /**
   * Whether alpha-beta cut-offs are applied. Turning them off explores the full tree.
   */
  public boolean isPruning() {
    return pruning;
  }

  public void setPruning(boolean pruning) {
    this.pruning = pruning;
  }

  public Weights getWeights() {
    return weights;
  }

  /**
   * Evaluation weights, bound from {@code search.weights.*}. Defaults mirror
   * {@link EvaluationWeights#defaults()}.
   */
  public static class Weights {
    private double winScore = EvaluationWeights.DEFAULT_WIN_SCORE;
    private double lifeDifference = 1.5;
    private double fieldAttack = 0.3;
    private double confrontationMargin = 0.5;
    private double attackStanceSwing = 200;
    private double handPower = 0.1;
    private double bestAttack = 0.15;
    private double handSize = 75;
    private double deckSize = 25;
    private double fusionPotential = 150;
    private double nextDraw = 0.05;
    private int lowLifeThreshold = 2000;
    private double lowLifeUrgency = 0.5;

    public EvaluationWeights toEvaluationWeights() {
      return new EvaluationWeights(winScore, lifeDifference, fieldAttack, confrontationMargin,
          attackStanceSwing, handPower, bestAttack, handSize, deckSize, fusionPotential, nextDraw,
          lowLifeThreshold, lowLifeUrgency);
    }

    public double getWinScore() {
      return winScore;
    }

    public void setWinScore(double winScore) {
      this.winScore = winScore;
    }

    public double getLifeDifference() {
      return lifeDifference;
    }

    public void setLifeDifference(double lifeDifference) {
      this.lifeDifference = lifeDifference;
    }

    public double getFieldAttack() {
      return fieldAttack;
    }

    public void setFieldAttack(double fieldAttack) {
      this.fieldAttack = fieldAttack;
    }

    public double getConfrontationMargin() {
      return confrontationMargin;
    }

    public void setConfrontationMargin(double confrontationMargin) {
      this.confrontationMargin = confrontationMargin;
    }

    public double getAttackStanceSwing() {
      return attackStanceSwing;
    }

    public void setAttackStanceSwing(double attackStanceSwing) {
      this.attackStanceSwing = attackStanceSwing;
    }

    public double getHandPower() {
      return handPower;
    }

    public void setHandPower(double handPower) {
      this.handPower = handPower;
    }

    public double getBestAttack() {
      return bestAttack;
    }

    public void setBestAttack(double bestAttack) {
      this.bestAttack = bestAttack;
    }

    public double getHandSize() {
      return handSize;
    }

    public void setHandSize(double handSize) {
      this.handSize = handSize;
    }

    public double getDeckSize() {
      return deckSize;
    }

    public void setDeckSize(double deckSize) {
      this.deckSize = deckSize;
    }

    public double getFusionPotential() {
      return fusionPotential;
    }

    public void setFusionPotential(double fusionPotential) {
      this.fusionPotential = fusionPotential;
    }

    public double getNextDraw() {
      return nextDraw;
    }

    public void setNextDraw(double nextDraw) {
      this.nextDraw = nextDraw;
    }

    public int getLowLifeThreshold() {
      return lowLifeThreshold;
    }

    public void setLowLifeThreshold(int lowLifeThreshold) {
      this.lowLifeThreshold = lowLifeThreshold;
    }

    public double getLowLifeUrgency() {
      return lowLifeUrgency;
    }

    public void setLowLifeUrgency(double lowLifeUrgency) {
      this.lowLifeUrgency = lowLifeUrgency;
    }
  }
}
