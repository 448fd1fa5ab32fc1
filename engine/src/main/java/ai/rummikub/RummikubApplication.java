package ai.rummikub;

import ai.rummikub.config.RulesProperties;
import ai.rummikub.config.SimulationProperties;
import ai.rummikub.game.TileDeck;
import ai.rummikub.player.Player;
import ai.rummikub.turn.GameState;
import ai.rummikub.turn.TurnEngine;
import ai.rummikub.turn.TurnOutcome;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RummikubApplication implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(RummikubApplication.class);

    private final RulesProperties rules;
    private final SimulationProperties simulation;
    private final PlayerFactory playerFactory;

    public RummikubApplication(RulesProperties rules, SimulationProperties simulation,
                               PlayerFactory playerFactory) {
        this.rules = rules;
        this.simulation = simulation;
        this.playerFactory = playerFactory;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(RummikubApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        // CLI entrypoint ignores the result; tests call play() directly.
        play();
    }

    /**
     * Plays one computer-only game with the configured strategies.
     *
     * <p>Each call deals a fresh deck (seeded when {@code simulation.seed} is set) and runs turns
     * until someone empties their hand or {@code simulation.max-turns} is reached.
     *
     * @return winner (if any), number of turns and wall-clock duration
     */
    public GameResult play() {
        List<String> strategies = simulation.getPlayers();
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalStateException("simulation.players must name at least one strategy");
        }

        List<String> playerIds = new ArrayList<>();
        List<Player> players = new ArrayList<>();
        for (int i = 0; i < strategies.size(); i++) {
            String strategy = strategies.get(i).trim();
            playerIds.add("p" + (i + 1) + "-" + strategy);
            players.add(playerFactory.create(strategy));
        }

        Random random = simulation.getSeed() != null ? new Random(simulation.getSeed()) : new Random();
        GameState state = GameState.deal(playerIds, new TileDeck(random), rules.getInitialHandSize());
        TurnEngine engine = new TurnEngine(state, players, rules);
        log.info("Starting game: players={}, draw pile={}", playerIds, state.getDrawPileSize());

        long startNanos = System.nanoTime();
        int turns = 0;
        while (!engine.isGameOver() && turns < simulation.getMaxTurns()) {
            TurnOutcome outcome = engine.playTurn();
            turns++;
            if (EpisodeLogger.isEnabled()) {
                EpisodeLogger.logTurn(turns, outcome, state.snapshot());
            }
            if (log.isDebugEnabled() && turns % 10 == 0) {
                log.debug("Turn {}: hands={} draw pile={}", turns, handSizes(state), state.getDrawPileSize());
            }
        }
        long durationNanos = System.nanoTime() - startNanos;

        Optional<String> winner = state.getWinnerId();
        if (winner.isPresent()) {
            log.info("Game over after {} turns. Winner: {}", turns, winner.get());
        } else {
            log.info("Game stopped at the {}-turn limit. Hands: {}", turns, handSizes(state));
        }
        if (EpisodeLogger.isEnabled()) {
            EpisodeLogger.logSummary(playerIds, winner.orElse(null), turns, durationNanos);
        }
        return new GameResult(winner.orElse(null), turns, durationNanos);
    }

    private static String handSizes(GameState state) {
        StringBuilder sb = new StringBuilder();
        for (String id : state.getPlayerIds()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(id).append('=').append(state.getHandSize(id));
        }
        return sb.toString();
    }

    /**
     * Lightweight summary of a single game run.
     */
    public static final class GameResult {
        private final String winnerId;
        private final int turns;
        private final long durationNanos;

        public GameResult(String winnerId, int turns, long durationNanos) {
            this.winnerId = winnerId;
            this.turns = turns;
            this.durationNanos = durationNanos;
        }

        public Optional<String> getWinnerId() {
            return Optional.ofNullable(winnerId);
        }

        public boolean isFinished() {
            return winnerId != null;
        }

        public int getTurns() {
            return turns;
        }

        public long getDurationNanos() {
            return durationNanos;
        }
    }
}
