package ai.rummikub.player.ai;

import ai.rummikub.game.Board;
import ai.rummikub.game.Tile;
import ai.rummikub.player.AIPlayer;
import ai.rummikub.player.TurnContext;
import ai.rummikub.solver.Solver;
import ai.rummikub.turn.PlayValidator;
import ai.rummikub.turn.TurnProposal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One-ply search over a small set of candidate plays.
 *
 * <p>Candidates are:
 * <ul>
 *   <li>drawing (always available, scores 0);</li>
 *   <li>every non-empty combination of the first {@value #MAX_SETS} independent hand melds;</li>
 *   <li>the greedy play, which may rearrange the board.</li>
 * </ul>
 * Candidates that would not reach the opening threshold are dropped before the opening meld.
 * With heuristics on, a candidate scores {@code tilesPlayed^1.5}; otherwise its face value, with
 * wildcards counted as {@value #WILDCARD_SCORE}. The time limit is checked before the greedy
 * plan is worked out and between candidates; once it has passed, the best candidate so far is
 * kept. The board for the winner is then built with the solver, which is bounded by its own
 * search budget rather than by the time limit. If that fails the player draws.
 */
public class LookaheadPlayer extends AIPlayer {
    private static final Logger log = LoggerFactory.getLogger(LookaheadPlayer.class);

    /** Independent melds considered for combinations; 2^5 - 1 subsets at most. */
    static final int MAX_SETS = 5;
    static final int WILDCARD_SCORE = 30;
    public static final long DEFAULT_TIME_LIMIT_MS = 1_000L;

    private final long timeLimitMs;
    private final boolean useHeuristics;
    private final LongSupplier nanoClock;

    public LookaheadPlayer() {
        this(DEFAULT_TIME_LIMIT_MS, true, new Solver());
    }

    public LookaheadPlayer(long timeLimitMs, boolean useHeuristics, Solver solver) {
        this(timeLimitMs, useHeuristics, solver, System::nanoTime);
    }

    LookaheadPlayer(long timeLimitMs, boolean useHeuristics, Solver solver, LongSupplier nanoClock) {
        super(solver);
        if (timeLimitMs <= 0) {
            throw new IllegalArgumentException("timeLimitMs must be > 0: " + timeLimitMs);
        }
        this.timeLimitMs = timeLimitMs;
        this.useHeuristics = useHeuristics;
        this.nanoClock = nanoClock;
    }

    @Override
    public TurnProposal decide(TurnContext context) {
        long deadline = nanoClock.getAsLong() + timeLimitMs * 1_000_000L;
        boolean opened = context.isOpeningMeldCompleted();

        List<Candidate> candidates = new ArrayList<>();
        candidates.add(new Candidate(Collections.emptyList(), 0));
        for (List<Tile> tiles : combinations(findIndependentMelds(context.getHand()))) {
            offer(candidates, tiles, context);
        }
        if (nanoClock.getAsLong() <= deadline) {
            planGreedy(context).ifPresent(plan -> offer(candidates, plan.claimed(), context));
        } else if (log.isDebugEnabled()) {
            log.debug("{}: time limit reached, skipping the greedy plan", context.getPlayerId());
        }

        candidates.sort(Comparator.comparingDouble(Candidate::score).reversed());
        Candidate best = candidates.get(0);
        for (Candidate candidate : candidates) {
            if (nanoClock.getAsLong() > deadline) {
                if (log.isDebugEnabled()) {
                    log.debug("{}: time limit reached after examining part of {} candidates",
                            context.getPlayerId(), candidates.size());
                }
                break;
            }
            if (evaluate(candidate) > evaluate(best)) {
                best = candidate;
            }
        }

        if (best.tiles().isEmpty()) {
            return TurnProposal.draw();
        }
        Optional<Board> board = boardWith(context.getBoard(), best.tiles(), opened);
        if (board.isEmpty()) {
            if (log.isDebugEnabled()) {
                log.debug("{}: no board found for {}; drawing", context.getPlayerId(), best.tiles());
            }
            return TurnProposal.draw();
        }
        return TurnProposal.play(board.get(), best.tiles());
    }

    private void offer(List<Candidate> candidates, List<Tile> tiles, TurnContext context) {
        if (tiles.isEmpty()) {
            return;
        }
        if (!context.isOpeningMeldCompleted()
                && PlayValidator.openingValue(tiles) < context.getOpeningThreshold()) {
            return;
        }
        candidates.add(new Candidate(List.copyOf(tiles), faceScore(tiles)));
    }

    private double evaluate(Candidate candidate) {
        if (useHeuristics) {
            return Math.pow(candidate.tiles().size(), 1.5);
        }
        return candidate.score();
    }

    /** Face value of the tiles with every wildcard worth {@value #WILDCARD_SCORE}. */
    static int faceScore(List<Tile> tiles) {
        int score = 0;
        for (Tile tile : tiles) {
            score += tile.isWildcard() ? WILDCARD_SCORE : tile.getValue();
        }
        return score;
    }

    /** Every non-empty union of the first {@value #MAX_SETS} sets. */
    static List<List<Tile>> combinations(List<List<Tile>> sets) {
        int n = Math.min(sets.size(), MAX_SETS);
        List<List<Tile>> results = new ArrayList<>();
        for (int mask = 1; mask < (1 << n); mask++) {
            List<Tile> union = new ArrayList<>();
            for (int j = 0; j < n; j++) {
                if ((mask >> j & 1) != 0) {
                    union.addAll(sets.get(j));
                }
            }
            results.add(union);
        }
        return results;
    }

    private record Candidate(List<Tile> tiles, int score) {
    }
}
