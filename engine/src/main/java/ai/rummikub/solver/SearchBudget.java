package ai.rummikub.solver;

import java.time.Duration;
import java.util.Objects;

/**
 * Upper bound on the work a single {@link Solver} search may perform.
 * <p>
 * A search stops as soon as it has expanded {@code maxNodes} search nodes or run for longer than
 * {@code timeLimit}, whichever comes first, and reports {@link SolveStatus#BUDGET_EXCEEDED}.
 *
 * @param maxNodes  maximum number of search nodes to expand (must be positive)
 * @param timeLimit maximum wall-clock time (must be positive)
 */
public record SearchBudget(long maxNodes, Duration timeLimit) {

    /** Node limit used by {@link #defaults()}. */
    public static final long DEFAULT_MAX_NODES = 100_000L;
    /** Time limit used by {@link #defaults()}. */
    public static final Duration DEFAULT_TIME_LIMIT = Duration.ofSeconds(1);

    /** Rejects non-positive limits. */
    public SearchBudget {
        Objects.requireNonNull(timeLimit, "timeLimit");
        if (maxNodes <= 0) {
            throw new IllegalArgumentException("maxNodes must be positive: " + maxNodes);
        }
        if (timeLimit.isZero() || timeLimit.isNegative()) {
            throw new IllegalArgumentException("timeLimit must be positive: " + timeLimit);
        }
    }

    public static SearchBudget defaults() {
        return new SearchBudget(DEFAULT_MAX_NODES, DEFAULT_TIME_LIMIT);
    }

    /**
     * A budget bounded only by node count (with a generous one-minute wall-clock guard).
     */
    public static SearchBudget ofNodes(long maxNodes) {
        return new SearchBudget(maxNodes, Duration.ofMinutes(1));
    }
}
