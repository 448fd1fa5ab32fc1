package ai.rummikub.turn;

/**
 * States of the turn engine. {@code Committed} and {@code Rejected} are not resting states;
 * they are reported through {@link TurnOutcome} while the engine moves on to the next player.
 */
public enum TurnPhase {
    /** Waiting for the current player to be asked, or for its proposal to arrive. */
    AWAITING_PROPOSAL,
    /** A proposal is being validated and applied. */
    EVALUATING,
    /** A player emptied their hand; no further turns are played. */
    GAME_OVER
}
