package ai.rummikub.player;

import ai.rummikub.turn.TurnProposal;
import java.util.concurrent.CompletableFuture;

/**
 * Represents a player capable of proposing what to do with its turn.
 * <p>
 * This is the single point where a turn may wait: AI strategies answer immediately with a
 * completed future, while a human bridge completes it once input arrives. The engine never
 * asks a second player while a proposal is outstanding.
 */
public interface Player {

    /**
     * Proposes this player's turn.
     *
     * @param context snapshot of everything the player may see; the board and hand in it are
     *                private copies the player may freely modify.
     * @return a future completed with a draw, or with a play whose claimed tiles come from the
     *         player's hand. Completing it exceptionally (or cancelling it) abandons the turn.
     */
    CompletableFuture<TurnProposal> proposeTurn(TurnContext context);
}
