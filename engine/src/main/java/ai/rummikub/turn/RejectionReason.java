package ai.rummikub.turn;

/**
 * Why a proposed Play was rejected. Every rejection is answered with the draw penalty.
 */
public enum RejectionReason {
    MALFORMED_PROPOSAL("The proposal was missing or had no board."),
    INVALID_BOARD("The proposed board contains a meld that is neither a group nor a run."),
    TILE_NOT_IN_HAND("A claimed tile is not in the player's hand."),
    EMPTY_PLAY("A play must move at least one tile out of the hand."),
    TILES_NOT_CONSERVED("The proposed board must hold exactly the current board tiles plus the claimed tiles."),
    OPENING_THRESHOLD_NOT_MET("The opening meld does not reach the required face value.");

    private final String message;

    RejectionReason(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
