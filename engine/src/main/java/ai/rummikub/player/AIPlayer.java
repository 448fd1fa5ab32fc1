package ai.rummikub.player;

import ai.rummikub.game.Board;
import ai.rummikub.game.Meld;
import ai.rummikub.game.Tile;
import ai.rummikub.game.TileColor;
import ai.rummikub.solver.SolveResult;
import ai.rummikub.solver.Solver;
import ai.rummikub.turn.PlayValidator;
import ai.rummikub.turn.TurnProposal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for computer players, with the meld-finding helpers the strategies share.
 * <p>
 * Computer players decide synchronously, so {@link #proposeTurn(TurnContext)} returns an already
 * completed future.
 */
public abstract class AIPlayer implements Player {
    private static final Logger log = LoggerFactory.getLogger(AIPlayer.class);

    private final Solver solver;

    protected AIPlayer(Solver solver) {
        this.solver = Objects.requireNonNull(solver, "solver");
    }

    @Override
    public CompletableFuture<TurnProposal> proposeTurn(TurnContext context) {
        return CompletableFuture.completedFuture(decide(context));
    }

    /**
     * Chooses this player's proposal for the turn described by {@code context}.
     */
    public abstract TurnProposal decide(TurnContext context);

    public Solver getSolver() {
        return solver;
    }

    /**
     * A play worked out by a strategy: the hand tiles it gives up and the board it leads to.
     */
    public record PlannedPlay(List<Tile> claimed, Board board) {
        public PlannedPlay {
            claimed = List.copyOf(claimed);
        }

        public TurnProposal toProposal() {
            return TurnProposal.play(board, claimed);
        }
    }

    /**
     * The two-phase greedy plan.
     * <p>
     * Phase A lays down the melds the hand can form on its own. Phase B then offers every
     * remaining hand tile to the pool and keeps it if the solver can still partition the pool.
     * After the opening meld the pool includes the board, so board melds may be rearranged;
     * before it the board is left as it is and the new melds are appended.
     *
     * @return the plan, or empty if nothing can be played or the opening value is not reached
     */
    protected Optional<PlannedPlay> planGreedy(TurnContext context) {
        boolean opened = context.isOpeningMeldCompleted();
        Board board = context.getBoard();
        List<Tile> pool = opened ? new ArrayList<>(board.getAllTiles()) : new ArrayList<>();
        List<Tile> claimed = new ArrayList<>();

        for (List<Tile> meld : findIndependentMelds(context.getHand())) {
            pool.addAll(meld);
            claimed.addAll(meld);
        }

        List<Meld> solution = null;
        if (!pool.isEmpty()) {
            SolveResult baseline = solver.search(pool);
            if (!baseline.isSolved()) {
                if (log.isDebugEnabled()) {
                    log.debug("{}: baseline pool of {} tiles not partitioned ({})",
                            context.getPlayerId(), pool.size(), baseline.getStatus());
                }
                return Optional.empty();
            }
            solution = baseline.getMelds().get();
        }

        Set<Tile> used = new HashSet<>(claimed);
        for (Tile tile : context.getHand()) {
            if (used.contains(tile)) {
                continue;
            }
            pool.add(tile);
            SolveResult attempt = solver.search(pool);
            if (attempt.isSolved()) {
                claimed.add(tile);
                solution = attempt.getMelds().get();
            } else {
                pool.remove(pool.size() - 1);
            }
        }

        if (claimed.isEmpty() || solution == null) {
            return Optional.empty();
        }
        if (!opened && PlayValidator.openingValue(claimed) < context.getOpeningThreshold()) {
            if (log.isDebugEnabled()) {
                log.debug("{}: holding {} points, below the opening threshold",
                        context.getPlayerId(), PlayValidator.openingValue(claimed));
            }
            return Optional.empty();
        }
        return Optional.of(new PlannedPlay(claimed, resultingBoard(board, solution, opened)));
    }

    /**
     * Builds the board that results from adding {@code claimed} to the table.
     * <p>
     * After the opening meld the whole table is re-partitioned; before it only the claimed
     * tiles are, and their melds are appended to the untouched board.
     *
     * @return the new board, or empty if the solver found no partition within its budget
     */
    protected Optional<Board> boardWith(Board board, List<Tile> claimed, boolean opened) {
        List<Tile> pool = opened ? new ArrayList<>(board.getAllTiles()) : new ArrayList<>();
        pool.addAll(claimed);
        return solver.search(pool).getMelds()
                .map(melds -> resultingBoard(board, melds, opened));
    }

    private static Board resultingBoard(Board board, List<Meld> solution, boolean opened) {
        if (opened) {
            return new Board(solution);
        }
        Board result = board.copy();
        for (Meld meld : solution) {
            result.addMeld(meld);
        }
        return result;
    }

    /**
     * Finds disjoint melds the hand can form without the board: first groups (one tile of each
     * colour for a value, when at least three colours are present), then runs of consecutive
     * values in one colour among the tiles left. Wildcards are kept back.
     *
     * @param hand the tiles to search
     * @return each meld as a list of tiles, groups first
     */
    public static List<List<Tile>> findIndependentMelds(List<Tile> hand) {
        List<List<Tile>> melds = new ArrayList<>();
        Set<Tile> used = new HashSet<>();

        Map<Integer, Map<TileColor, Tile>> byValue = new LinkedHashMap<>();
        for (Tile tile : hand) {
            if (tile.isWildcard()) {
                continue;
            }
            byValue.computeIfAbsent(tile.getValue(), v -> new EnumMap<>(TileColor.class))
                    .putIfAbsent(tile.getColor(), tile);
        }
        for (Map<TileColor, Tile> colours : byValue.values()) {
            if (colours.size() >= Meld.MIN_SIZE) {
                List<Tile> group = new ArrayList<>(colours.values());
                melds.add(Collections.unmodifiableList(group));
                used.addAll(group);
            }
        }

        Map<TileColor, List<Tile>> byColour = new EnumMap<>(TileColor.class);
        for (Tile tile : hand) {
            if (!tile.isWildcard() && !used.contains(tile)) {
                byColour.computeIfAbsent(tile.getColor(), c -> new ArrayList<>()).add(tile);
            }
        }
        for (List<Tile> tiles : byColour.values()) {
            tiles.sort(Tile.CANONICAL_ORDER);
            List<Tile> run = new ArrayList<>();
            for (Tile tile : tiles) {
                if (run.isEmpty()) {
                    run.add(tile);
                    continue;
                }
                int last = run.get(run.size() - 1).getValue();
                if (tile.getValue() == last) {
                    continue; // duplicate
                }
                if (tile.getValue() != last + 1) {
                    flushRun(run, melds);
                    run = new ArrayList<>();
                }
                run.add(tile);
            }
            flushRun(run, melds);
        }
        return melds;
    }

    private static void flushRun(List<Tile> run, List<List<Tile>> melds) {
        if (run.size() >= Meld.MIN_SIZE) {
            melds.add(Collections.unmodifiableList(new ArrayList<>(run)));
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName();
    }
}
