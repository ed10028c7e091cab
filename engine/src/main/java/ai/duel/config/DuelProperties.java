package ai.duel.config;

import ai.duel.game.MatchRules;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the match itself ({@code duel.*}).
 */
@Component
@ConfigurationProperties(prefix = "duel")
public class DuelProperties {
  private int deckSize = MatchRules.DEFAULT_DECK_SIZE;
  private int startingLifePoints = MatchRules.DEFAULT_LIFE_POINTS;
  private int handLimit = MatchRules.DEFAULT_HAND_LIMIT;
  private int maxTurns = 200;
  private String humanName = "Player";
  private String aiName = "AI";

  /** Shuffle seed; a random seed is used when unset. */
  private Long seed;

  /**
   * Builds the rules for a new match. The deck size is clamped to the allowed range here.
   */
  public MatchRules toRules() {
    return new MatchRules(startingLifePoints, handLimit, handLimit, deckSize);
  }

  public int getDeckSize() {
    return deckSize;
  }

  public void setDeckSize(int deckSize) {
    this.deckSize = deckSize;
  }

  public int getStartingLifePoints() {
    return startingLifePoints;
  }

  public void setStartingLifePoints(int startingLifePoints) {
    this.startingLifePoints = startingLifePoints;
  }

  public int getHandLimit() {
    return handLimit;
  }

  public void setHandLimit(int handLimit) {
    this.handLimit = handLimit;
  }

  /**
   * Turn at which a runaway match is stopped without a winner.
   */
  public int getMaxTurns() {
    return maxTurns;
  }

  public void setMaxTurns(int maxTurns) {
    this.maxTurns = maxTurns;
  }

  public String getHumanName() {
    return humanName;
  }

  public void setHumanName(String humanName) {
    this.humanName = humanName;
  }

  public String getAiName() {
    return aiName;
  }

  public void setAiName(String aiName) {
    this.aiName = aiName;
  }

  public Long getSeed() {
    return seed;
  }

  public void setSeed(Long seed) {
    this.seed = seed;
  }
}
