package ai.duel.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for training mode.
 * 
 * When enabled, a human's play does not end the main phase: the play can be taken back with
 * {@code undo} (the card returns to the hand and any card it replaced returns to the field)
 * and is confirmed with {@code pass}.
 * 
 * Usage:
 * {@code mvn -pl engine spring-boot:run -Dspring-boot.run.arguments=--training.mode=true}
 */
@Component
@ConfigurationProperties(prefix = "training")
public class TrainingModeProperties {
  private boolean mode = false;

  /**
   * Returns whether training mode is enabled.
   * @return true if plays can be undone before they are confirmed
   */
  public boolean isMode() {
    return mode;
  }

  public void setMode(boolean mode) {
    this.mode = mode;
  }
}
