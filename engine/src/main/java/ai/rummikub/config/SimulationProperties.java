package ai.rummikub.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the command-line simulation.
 * 
 * Selects the strategy sitting in each seat and bounds the length of a game. Strategy names are
 * resolved by {@code PlayerFactory}: {@code greedy}, {@code hoarding} and {@code lookahead}.
 * 
 * Usage:
 * {@code java -jar engine.jar --simulation.players=greedy,lookahead --simulation.seed=42}
 * 
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "simulation")
public class SimulationProperties {
  private List<String> players = new ArrayList<>(List.of("greedy", "hoarding"));
  private int maxTurns = 500;
  private Long seed;
  private int hoardingThreshold = 20;
  private long lookaheadTimeLimitMs = 1000;

  /**
   * Strategy name for each seat, in seating order.
   * @return the configured strategies
   */
  public List<String> getPlayers() {
    return players;
  }

  public void setPlayers(List<String> players) {
    this.players = players;
  }

  /**
   * Safety cap on turns per game; the game ends without a winner when it is reached.
   * @return the turn cap
   */
  public int getMaxTurns() {
    return maxTurns;
  }

  public void setMaxTurns(int maxTurns) {
    this.maxTurns = maxTurns;
  }

  /**
   * Seed for the shuffle, or null for a random game.
   * @return the seed, may be null
   */
  public Long getSeed() {
    return seed;
  }

  public void setSeed(Long seed) {
    this.seed = seed;
  }

  public int getHoardingThreshold() {
    return hoardingThreshold;
  }

  public void setHoardingThreshold(int hoardingThreshold) {
    this.hoardingThreshold = hoardingThreshold;
  }

  public long getLookaheadTimeLimitMs() {
    return lookaheadTimeLimitMs;
  }

  public void setLookaheadTimeLimitMs(long lookaheadTimeLimitMs) {
    this.lookaheadTimeLimitMs = lookaheadTimeLimitMs;
  }
}
