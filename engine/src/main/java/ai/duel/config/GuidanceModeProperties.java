package ai.duel.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for guidance mode.
 * 
 * When enabled, the console lists the legal actions before each human command and shows the
 * upcoming cards of both decks.
 */
@Component
@ConfigurationProperties(prefix = "guidance")
public class GuidanceModeProperties {
  private boolean mode = true;

  public boolean isMode() {
    return mode;
  }

  public void setMode(boolean mode) {
    this.mode = mode;
  }
}
