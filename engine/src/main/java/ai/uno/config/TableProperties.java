package ai.uno.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the table: how many seats, which automated
 * policy fills them, the shuffle seed and the runner's safety cap on turns.
 *
 * Usage:
 * {@code java -jar engine.jar --table.players=4 --table.seed=42 --table.ai-policy=simple}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "table")
public class TableProperties {
  private int players = 2;
  private Long seed;
  private int maxTurns = 10_000;
  private String aiPolicy = "aggressive";

  /**
   * Returns the number of seats, human included.
   * @return seat count; at least 2 for a valid game
   */
  public int getPlayers() {
    return players;
  }

  public void setPlayers(int players) {
    this.players = players;
  }

  /**
   * Returns the shuffle seed.
   * @return the seed, or null to seed from the clock
   */
  public Long getSeed() {
    return seed;
  }

  public void setSeed(Long seed) {
    this.seed = seed;
  }

  /**
   * Returns the maximum number of turns the runner plays before giving up.
   * @return the cap; 0 means unlimited
   */
  public int getMaxTurns() {
    return maxTurns;
  }

  public void setMaxTurns(int maxTurns) {
    this.maxTurns = maxTurns;
  }

  /**
   * Returns the policy name of the automated seats ("aggressive" or "simple").
   * @return the policy name
   */
  public String getAiPolicy() {
    return aiPolicy;
  }

  public void setAiPolicy(String aiPolicy) {
    this.aiPolicy = aiPolicy;
  }
}
