package ai.rummikub.turn;

import ai.rummikub.game.Board;
import ai.rummikub.game.Tile;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable copy of the whole game state, in the shape a host application would persist.
 * The encoding (JSON, binary, ...) is left to the host; see {@code EpisodeLogger} for one.
 *
 * @param board                 a private copy of the board
 * @param hands                 each player's tiles, in seating order
 * @param drawPile              the remaining draw pile, bottom first
 * @param currentPlayerIndex    seat of the player to move
 * @param openingMeldCompleted  whether each player has made their opening meld
 * @param terminal              {@code true} once someone has won
 * @param winnerId              the winner, or {@code null} while the game is running
 */
public record GameSnapshot(
        Board board,
        Map<String, List<Tile>> hands,
        List<Tile> drawPile,
        int currentPlayerIndex,
        Map<String, Boolean> openingMeldCompleted,
        boolean terminal,
        String winnerId) {

    /** Copies every collection so the snapshot never changes after creation. */
    public GameSnapshot {
        board = board.copy();
        Map<String, List<Tile>> handsCopy = new LinkedHashMap<>();
        for (Map.Entry<String, List<Tile>> entry : hands.entrySet()) {
            handsCopy.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        hands = Collections.unmodifiableMap(handsCopy);
        drawPile = List.copyOf(drawPile);
        openingMeldCompleted = Collections.unmodifiableMap(new LinkedHashMap<>(openingMeldCompleted));
    }

    /**
     * Returns a copy of the board, so the snapshot itself stays unchanged.
     */
    @Override
    public Board board() {
        return board.copy();
    }

    public Optional<String> winner() {
        return Optional.ofNullable(winnerId);
    }
}
