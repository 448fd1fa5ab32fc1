package ai.rummikub.config;

import ai.rummikub.solver.SearchBudget;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the game rules enforced by the turn engine.
 *
 * The defaults are the standard rules, so the engine can also be built without Spring
 * ({@code new RulesProperties()}), as the unit tests do.
 *
 * Usage:
 * {@code java -jar engine.jar --rules.opening-threshold=30 --rules.solver-max-nodes=200000}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "rules")
public class RulesProperties {
  private int openingThreshold = 30;
  private int penaltyDraws = 3;
  private int initialHandSize = 14;
  private boolean enforceTileConservation = true;
  private long solverMaxNodes = SearchBudget.DEFAULT_MAX_NODES;
  private long solverTimeLimitMs = SearchBudget.DEFAULT_TIME_LIMIT.toMillis();

  /**
   * Minimum face value (wildcards count 0) of the tiles claimed by a player's opening play.
   * @return the opening threshold
   */
  public int getOpeningThreshold() {
    return openingThreshold;
  }

  public void setOpeningThreshold(int openingThreshold) {
    this.openingThreshold = openingThreshold;
  }

  /**
   * Tiles drawn as a penalty when a play is rejected.
   * @return the penalty draw count
   */
  public int getPenaltyDraws() {
    return penaltyDraws;
  }

  public void setPenaltyDraws(int penaltyDraws) {
    this.penaltyDraws = penaltyDraws;
  }

  public int getInitialHandSize() {
    return initialHandSize;
  }

  public void setInitialHandSize(int initialHandSize) {
    this.initialHandSize = initialHandSize;
  }

  /**
   * Whether a play must keep every board tile and add exactly the claimed tiles.
   * @return true if tile conservation is checked
   */
  public boolean isEnforceTileConservation() {
    return enforceTileConservation;
  }

  public void setEnforceTileConservation(boolean enforceTileConservation) {
    this.enforceTileConservation = enforceTileConservation;
  }

  public long getSolverMaxNodes() {
    return solverMaxNodes;
  }

  public void setSolverMaxNodes(long solverMaxNodes) {
    this.solverMaxNodes = solverMaxNodes;
  }

  public long getSolverTimeLimitMs() {
    return solverTimeLimitMs;
  }

  public void setSolverTimeLimitMs(long solverTimeLimitMs) {
    this.solverTimeLimitMs = solverTimeLimitMs;
  }

  /**
   * Builds the search budget handed to every solver created for this game.
   * @return the configured budget
   */
  public SearchBudget toSearchBudget() {
    return new SearchBudget(solverMaxNodes, Duration.ofMillis(solverTimeLimitMs));
  }
}
