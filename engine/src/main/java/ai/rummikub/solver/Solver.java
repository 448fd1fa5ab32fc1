package ai.rummikub.solver;

import ai.rummikub.game.Meld;
import ai.rummikub.game.Tile;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exact-cover search: partitions a multiset of tiles into valid {@link Meld}s that use every
 * tile exactly once.
 * <p>
 * <strong>Search:</strong> the tiles are sorted into {@link Tile#CANONICAL_ORDER} (value, then
 * colour, wildcards last). At every node the first remaining tile is the anchor; since it must
 * belong to exactly one meld, the search enumerates every valid meld that contains it and
 * recurses on what is left:
 * <ol>
 *   <li>Groups: the anchor plus 2 or 3 tiles of the same value or wildcards.</li>
 *   <li>Runs: the anchor extended upwards one value at a time (same colour or wildcard),
 *       optionally padded with spare wildcards, which may sit below the anchor.</li>
 * </ol>
 * When only wildcards remain they form one final meld or the branch fails.
 * <p>
 * <strong>Pruning:</strong> interchangeable tiles (same colour and value, or any two wildcards)
 * are never tried twice in the same role, and remaining pools already proven unsolvable are
 * remembered by their tile types. The search is still exponential in the worst case, so every
 * search runs under a {@link SearchBudget}.
 * <p>
 * Instances hold no mutable state and may be shared between threads.
 */
public final class Solver {
    private static final Logger log = LoggerFactory.getLogger(Solver.class);

    /** How often (in nodes) the wall clock is consulted. */
    private static final int CLOCK_CHECK_INTERVAL = 1024;

    private final SearchBudget budget;

    /**
     * Creates a solver with {@link SearchBudget#defaults()}.
     */
    public Solver() {
        this(SearchBudget.defaults());
    }

    public Solver(SearchBudget budget) {
        this.budget = Objects.requireNonNull(budget, "budget");
    }

    public SearchBudget getBudget() {
        return budget;
    }

    /**
     * Searches for a partition of {@code tiles} into valid melds.
     *
     * @param tiles the tiles to partition; each physical tile at most once
     * @return the status, plus the melds when {@link SolveStatus#SOLVED}
     * @throws IllegalArgumentException if the same tile appears twice
     */
    public SolveResult search(Collection<Tile> tiles) {
        Objects.requireNonNull(tiles, "tiles");
        if (new HashSet<>(tiles).size() != tiles.size()) {
            throw new IllegalArgumentException("The same tile appears more than once in the input");
        }
        if (tiles.isEmpty()) {
            return SolveResult.solved(Collections.emptyList(), 0);
        }
        if (tiles.size() < Meld.MIN_SIZE) {
            return SolveResult.noPartition(0);
        }

        List<Tile> pool = new ArrayList<>(tiles);
        pool.sort(Tile.CANONICAL_ORDER);

        SearchRun run = new SearchRun(budget);
        try {
            List<Meld> melds = run.backtrack(pool);
            if (melds == null) {
                return SolveResult.noPartition(run.nodes);
            }
            return SolveResult.solved(melds, run.nodes);
        } catch (BudgetExhausted e) {
            if (log.isDebugEnabled()) {
                log.debug("Partition search over {} tiles gave up after {} nodes", tiles.size(), run.nodes);
            }
            return SolveResult.budgetExceeded(run.nodes);
        }
    }

    /**
     * Finds a partition of {@code tiles} into valid melds.
     *
     * @param tiles the tiles to partition
     * @return the melds, or empty if it is proven that no partition exists
     * @throws SearchBudgetExceededException if the budget ran out before an answer was reached
     */
    public Optional<List<Meld>> solve(Collection<Tile> tiles) {
        SolveResult result = search(tiles);
        if (result.getStatus() == SolveStatus.BUDGET_EXCEEDED) {
            throw new SearchBudgetExceededException(result.getNodesVisited(), budget);
        }
        return result.getMelds();
    }

    /**
     * Convenience check used by strategies: {@code true} only when a partition was found.
     * An exhausted budget counts as "not playable".
     */
    public boolean isPlayable(Collection<Tile> tiles) {
        return search(tiles).isSolved();
    }

    /**
     * State of one search: node counter, deadline and the memo of dead pools.
     */
    private static final class SearchRun {
        private final long maxNodes;
        private final long deadlineNanos;
        private final Set<String> deadEnds = new HashSet<>();
        private long nodes;

        SearchRun(SearchBudget budget) {
            this.maxNodes = budget.maxNodes();
            this.deadlineNanos = System.nanoTime() + budget.timeLimit().toNanos();
        }

        /**
         * Returns a partition of {@code pool} (sorted canonically), or {@code null} if none exists.
         * The returned list is mutable so callers can prepend their meld.
         */
        List<Meld> backtrack(List<Tile> pool) {
            tick();
            if (pool.isEmpty()) {
                return new ArrayList<>();
            }
            String key = signature(pool);
            if (deadEnds.contains(key)) {
                return null;
            }

            Tile anchor = pool.get(0);
            if (anchor.isWildcard()) {
                // Wildcards sort last, so the pool is all wildcards: one meld or nothing.
                Meld rest = new Meld(pool);
                if (rest.validate()) {
                    List<Meld> solution = new ArrayList<>();
                    solution.add(rest);
                    return solution;
                }
                deadEnds.add(key);
                return null;
            }

            for (Meld candidate : candidateMelds(anchor, pool)) {
                List<Meld> rest = backtrack(without(pool, candidate));
                if (rest != null) {
                    rest.add(0, candidate);
                    return rest;
                }
            }
            deadEnds.add(key);
            return null;
        }

        private void tick() {
            nodes++;
            if (nodes > maxNodes) {
                throw new BudgetExhausted();
            }
            if (nodes % CLOCK_CHECK_INTERVAL == 0 && System.nanoTime() > deadlineNanos) {
                throw new BudgetExhausted();
            }
        }
    }

    /**
     * Every valid meld containing {@code anchor}, groups first, one per combination of tile types.
     */
    static List<Meld> candidateMelds(Tile anchor, List<Tile> pool) {
        List<Meld> candidates = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        List<Tile> groupMates = new ArrayList<>();
        List<Tile> runMates = new ArrayList<>();
        for (Tile tile : pool) {
            if (tile.equals(anchor)) {
                continue;
            }
            if (tile.isWildcard() || tile.getValue() == anchor.getValue()) {
                groupMates.add(tile);
            }
            if (tile.isWildcard() || tile.getColor() == anchor.getColor()) {
                runMates.add(tile);
            }
        }

        for (int others = Meld.MIN_SIZE - 1; others <= Meld.MAX_GROUP_SIZE - 1; others++) {
            List<List<Tile>> combos = new ArrayList<>();
            combinations(groupMates, others, 0, new ArrayList<>(), combos);
            for (List<Tile> combo : combos) {
                List<Tile> tiles = new ArrayList<>(combo.size() + 1);
                tiles.add(anchor);
                tiles.addAll(combo);
                offer(tiles, candidates, seen);
            }
        }

        List<Tile> sequence = new ArrayList<>();
        sequence.add(anchor);
        extendRun(sequence, anchor.getValue(), runMates, candidates, seen);
        return candidates;
    }

    /**
     * Records {@code sequence} (padded with 0..n spare wildcards) as run candidates, then tries
     * every distinct tile type that can take the next value.
     */
    private static void extendRun(List<Tile> sequence, int value, List<Tile> remaining,
                                  List<Meld> candidates, Set<String> seen) {
        List<Tile> spareWildcards = new ArrayList<>();
        for (Tile tile : remaining) {
            if (tile.isWildcard()) {
                spareWildcards.add(tile);
            }
        }
        for (int extra = 0; extra <= spareWildcards.size(); extra++) {
            if (sequence.size() + extra < Meld.MIN_SIZE) {
                continue;
            }
            List<Tile> tiles = new ArrayList<>(sequence);
            tiles.addAll(spareWildcards.subList(0, extra));
            offer(tiles, candidates, seen);
        }

        if (sequence.size() >= Tile.MAX_VALUE || value >= Tile.MAX_VALUE) {
            return;
        }
        int nextValue = value + 1;
        Set<String> triedTypes = new HashSet<>();
        for (Tile tile : remaining) {
            if (!tile.isWildcard() && tile.getValue() != nextValue) {
                continue;
            }
            if (!triedTypes.add(tile.typeKey())) {
                continue;
            }
            List<Tile> extended = new ArrayList<>(sequence);
            extended.add(tile);
            List<Tile> rest = new ArrayList<>(remaining);
            rest.remove(tile);
            extendRun(extended, nextValue, rest, candidates, seen);
        }
    }

    private static void offer(List<Tile> tiles, List<Meld> candidates, Set<String> seen) {
        Meld meld = new Meld(tiles);
        if (!meld.validate()) {
            return;
        }
        List<Tile> sorted = new ArrayList<>(tiles);
        sorted.sort(Tile.CANONICAL_ORDER);
        if (seen.add(signature(sorted))) {
            candidates.add(meld);
        }
    }

    private static void combinations(List<Tile> source, int k, int start, List<Tile> current,
                                     List<List<Tile>> out) {
        if (current.size() == k) {
            out.add(new ArrayList<>(current));
            return;
        }
        for (int i = start; i < source.size(); i++) {
            current.add(source.get(i));
            combinations(source, k, i + 1, current, out);
            current.remove(current.size() - 1);
        }
    }

    private static List<Tile> without(List<Tile> pool, Meld meld) {
        Set<Tile> used = new HashSet<>(meld.getTiles());
        List<Tile> rest = new ArrayList<>(pool.size() - used.size());
        for (Tile tile : pool) {
            if (!used.contains(tile)) {
                rest.add(tile);
            }
        }
        return rest;
    }

    /** Tile types of a canonically sorted list; equal for pools that differ only by identity. */
    private static String signature(List<Tile> sorted) {
        StringBuilder sb = new StringBuilder(sorted.size() * 3);
        for (Tile tile : sorted) {
            sb.append(tile.typeKey()).append(',');
        }
        return sb.toString();
    }

    /** Unwinds the recursion when the budget runs out. */
    private static final class BudgetExhausted extends RuntimeException {
        BudgetExhausted() {
            super(null, null, false, false);
        }
    }
}
