package ai.rummikub.solver;

import ai.rummikub.game.Meld;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Result of {@link Solver#search(java.util.Collection)}: the status, the melds when solved, and
 * how many search nodes were expanded.
 */
public final class SolveResult {
    private final SolveStatus status;
    private final List<Meld> melds;
    private final long nodesVisited;

    private SolveResult(SolveStatus status, List<Meld> melds, long nodesVisited) {
        this.status = status;
        this.melds = melds;
        this.nodesVisited = nodesVisited;
    }

    static SolveResult solved(List<Meld> melds, long nodesVisited) {
        return new SolveResult(SolveStatus.SOLVED, Collections.unmodifiableList(melds), nodesVisited);
    }

    static SolveResult noPartition(long nodesVisited) {
        return new SolveResult(SolveStatus.NO_PARTITION, null, nodesVisited);
    }

    static SolveResult budgetExceeded(long nodesVisited) {
        return new SolveResult(SolveStatus.BUDGET_EXCEEDED, null, nodesVisited);
    }

    public SolveStatus getStatus() {
        return status;
    }

    public boolean isSolved() {
        return status == SolveStatus.SOLVED;
    }

    /**
     * Returns the partition when solved, otherwise empty. An empty optional does not tell a
     * proven negative from an exhausted budget; check {@link #getStatus()} for that.
     */
    public Optional<List<Meld>> getMelds() {
        return Optional.ofNullable(melds);
    }

    public long getNodesVisited() {
        return nodesVisited;
    }

    @Override
    public String toString() {
        return "SolveResult(" + status + ", melds=" + melds + ", nodes=" + nodesVisited + ")";
    }
}
