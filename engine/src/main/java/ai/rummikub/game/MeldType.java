package ai.rummikub.game;

/**
 * Classification of a meld. The type is always derived from the tiles, never stored.
 */
public enum MeldType {
    /** Three or four tiles of one value in pairwise-distinct colours. */
    GROUP,
    /** Three or more consecutive values in a single colour. */
    RUN,
    /** Neither a group nor a run. */
    INVALID
}
