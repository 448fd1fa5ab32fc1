package ai.rummikub;

import ai.rummikub.config.RulesProperties;
import ai.rummikub.config.SimulationProperties;
import ai.rummikub.player.Player;
import ai.rummikub.player.ai.GreedyPlayer;
import ai.rummikub.player.ai.HoardingPlayer;
import ai.rummikub.player.ai.LookaheadPlayer;
import ai.rummikub.solver.Solver;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Builds computer players from the strategy names used in {@code simulation.players}.
 * <p>
 * Known names: {@code greedy}, {@code hoarding}, {@code lookahead}. Every player gets its own
 * {@link Solver} with the budget from {@link RulesProperties}.
 */
@Component
public class PlayerFactory {
    private final RulesProperties rules;
    private final SimulationProperties simulation;

    public PlayerFactory(RulesProperties rules, SimulationProperties simulation) {
        this.rules = rules;
        this.simulation = simulation;
    }

    /**
     * @param strategy strategy name, case-insensitive
     * @return a fresh player
     * @throws IllegalArgumentException for an unknown name
     */
    public Player create(String strategy) {
        Solver solver = new Solver(rules.toSearchBudget());
        switch (strategy.trim().toLowerCase(Locale.ROOT)) {
            case "greedy":
                return new GreedyPlayer(solver);
            case "hoarding":
                return new HoardingPlayer(simulation.getHoardingThreshold(), solver);
            case "lookahead":
                return new LookaheadPlayer(simulation.getLookaheadTimeLimitMs(), true, solver);
            default:
                throw new IllegalArgumentException("Unknown player strategy: " + strategy
                        + " (expected greedy, hoarding or lookahead)");
        }
    }
}
