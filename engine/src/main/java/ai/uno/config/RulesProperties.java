package ai.uno.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for house rules.
 *
 * When no-mercy is enabled, a card drawn by choice that matches the discard pile is played
 * immediately instead of being kept.
 *
 * Usage:
 * {@code java -jar engine.jar --rules.no-mercy=false}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "rules")
public class RulesProperties {
  private boolean noMercy = true;

  /**
   * Returns whether the no-mercy auto-play rule is enabled.
   * @return true if matching drawn cards are auto-played
   */
  public boolean isNoMercy() {
    return noMercy;
  }

  /**
   * Sets the no-mercy auto-play rule enabled/disabled.
   * @param noMercy true to auto-play matching drawn cards
   */
  public void setNoMercy(boolean noMercy) {
    this.noMercy = noMercy;
  }
}
