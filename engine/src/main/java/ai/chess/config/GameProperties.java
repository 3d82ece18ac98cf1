package ai.chess.config;

import ai.chess.game.PieceColor;
import java.util.Random;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for a console game session.
 *
 * Usage:
 * {@code mvn -pl engine spring-boot:run -Dspring-boot.run.arguments="--chess.ai-color=WHITE --chess.ai.seed=42"}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "chess")
public class GameProperties {
  private PieceColor aiColor = PieceColor.BLACK;
  private boolean selfPlay = false;
  private int maxPlies = 500;
  private final Ai ai = new Ai();

  /**
   * Returns the side played by the greedy agent when a human is playing.
   * @return the agent's color
   */
  public PieceColor getAiColor() {
    return aiColor;
  }

  public void setAiColor(PieceColor aiColor) {
    this.aiColor = aiColor;
  }

  /**
   * Returns whether the agent plays both sides.
   * @return true for an unattended agent-versus-agent session
   */
  public boolean isSelfPlay() {
    return selfPlay;
  }

  public void setSelfPlay(boolean selfPlay) {
    this.selfPlay = selfPlay;
  }

  /**
   * Returns the number of plies after which a session stops.
   * @return the ply cap
   */
  public int getMaxPlies() {
    return maxPlies;
  }

  public void setMaxPlies(int maxPlies) {
    this.maxPlies = maxPlies;
  }

  public Ai getAi() {
    return ai;
  }

  /**
   * Settings for the greedy agent, bound from {@code chess.ai.*}.
   */
  public static class Ai {
    private Long seed;

    /**
     * Returns the seed for the agent's tie-break random source, or null for an unseeded source.
     * @return the configured seed, may be null
     */
    public Long getSeed() {
      return seed;
    }

    public void setSeed(Long seed) {
      this.seed = seed;
    }

    /**
     * Creates the random source described by these settings.
     * @return a seeded {@link Random} when a seed is configured, otherwise an unseeded one
     */
    public Random createRandom() {
      return seed != null ? new Random(seed) : new Random();
    }
  }
}
