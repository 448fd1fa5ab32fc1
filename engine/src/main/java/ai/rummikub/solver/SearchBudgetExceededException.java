package ai.rummikub.solver;

/**
 * Thrown by {@link Solver#solve(java.util.Collection)} when the search ran out of budget before
 * it could either find a partition or prove that none exists.
 */
public class SearchBudgetExceededException extends RuntimeException {

    private final long nodesVisited;
    private final SearchBudget budget;

    public SearchBudgetExceededException(long nodesVisited, SearchBudget budget) {
        super("Partition search exceeded its budget after " + nodesVisited + " nodes (limit "
                + budget.maxNodes() + " nodes / " + budget.timeLimit().toMillis() + " ms)");
        this.nodesVisited = nodesVisited;
        this.budget = budget;
    }

    public long getNodesVisited() {
        return nodesVisited;
    }

    public SearchBudget getBudget() {
        return budget;
    }
}
