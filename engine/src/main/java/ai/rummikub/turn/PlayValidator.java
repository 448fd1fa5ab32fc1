package ai.rummikub.turn;

import ai.rummikub.config.RulesProperties;
import ai.rummikub.game.Board;
import ai.rummikub.game.Meld;
import ai.rummikub.game.Tile;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Legality checks for a proposed Play.
 * <p>
 * Checks run in a fixed order and stop at the first failure:
 * <ol>
 *   <li>every meld of the proposed board is valid;</li>
 *   <li>every claimed tile is in the player's hand (by identity);</li>
 *   <li>at least one tile is claimed;</li>
 *   <li>the proposed board holds exactly the current board tiles plus the claimed tiles
 *       (when {@link RulesProperties#isEnforceTileConservation()} is on);</li>
 *   <li>before the opening meld, the claimed tiles reach the opening threshold.</li>
 * </ol>
 * The checks have no side effects; strategies can run them before proposing.
 */
public final class PlayValidator {
    private PlayValidator() {
    }

    /**
     * Checks a Play against the current position.
     *
     * @param currentBoard  the canonical board before the play
     * @param proposal      the proposed play
     * @param hand          the player's current hand
     * @param openingDone   whether the player already made their opening meld
     * @param rules         the rules in force
     * @return the first violated rule, or empty if the play is legal
     */
    public static Optional<RejectionReason> check(
            Board currentBoard,
            TurnProposal proposal,
            List<Tile> hand,
            boolean openingDone,
            RulesProperties rules) {

        if (proposal == null || proposal.isDraw() || proposal.getNewBoard() == null) {
            return Optional.of(RejectionReason.MALFORMED_PROPOSAL);
        }
        Board newBoard = proposal.getNewBoard();
        List<Tile> claimed = proposal.getClaimedTiles();

        if (!newBoard.isValid()) {
            return Optional.of(RejectionReason.INVALID_BOARD);
        }

        Set<Tile> handTiles = new HashSet<>(hand);
        for (Tile tile : claimed) {
            if (!handTiles.contains(tile)) {
                return Optional.of(RejectionReason.TILE_NOT_IN_HAND);
            }
        }

        if (claimed.isEmpty()) {
            return Optional.of(RejectionReason.EMPTY_PLAY);
        }

        if (rules.isEnforceTileConservation() && !conservesTiles(currentBoard, newBoard, claimed)) {
            return Optional.of(RejectionReason.TILES_NOT_CONSERVED);
        }

        if (!openingDone && openingValue(claimed) < rules.getOpeningThreshold()) {
            return Optional.of(RejectionReason.OPENING_THRESHOLD_NOT_MET);
        }
        return Optional.empty();
    }

    /**
     * Value credited to an opening play: the face values of the claimed tiles, wildcards 0.
     */
    public static int openingValue(List<Tile> claimed) {
        return Meld.faceValue(claimed);
    }

    /**
     * {@code true} when {@code newBoard} is exactly the old board's tiles plus {@code claimed},
     * with no tile appearing twice.
     */
    static boolean conservesTiles(Board currentBoard, Board newBoard, List<Tile> claimed) {
        if (newBoard.hasDuplicateTiles()) {
            return false;
        }
        Set<Tile> expected = new HashSet<>(currentBoard.getAllTiles());
        for (Tile tile : claimed) {
            // A claimed tile already on the board, or claimed twice.
            if (!expected.add(tile)) {
                return false;
            }
        }
        List<Tile> actual = newBoard.getAllTiles();
        return actual.size() == expected.size() && expected.containsAll(actual);
    }
}
