package ai.rummikub.solver;

/**
 * Outcome of a partition search.
 */
public enum SolveStatus {
    /** A partition into valid melds was found. */
    SOLVED,
    /** The search proved that no partition exists. */
    NO_PARTITION,
    /** The search gave up before reaching an answer; nothing is known about the tiles. */
    BUDGET_EXCEEDED
}
