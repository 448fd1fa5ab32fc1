package ai.rummikub.turn;

import ai.rummikub.game.Board;
import ai.rummikub.game.Tile;
import ai.rummikub.game.TileDeck;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Complete state of one running game: the canonical board, the draw pile, each player's hand,
 * whose turn it is, who has made their opening meld, and the winner once there is one.
 * <p>
 * Readers get copies or unmodifiable views. All mutators are package-private: only
 * {@link TurnEngine} changes the state, and only while resolving a turn.
 */
public class GameState {
    /** Player ids in seating order; turns go round in this order. */
    private final List<String> playerIds;
    /** The canonical board; never handed out directly. */
    private Board board;
    /** Face-down tiles; drawn from the end. */
    private final TileDeck drawPile;
    /** Each player's hand, exclusively owned until played. */
    private final Map<String, List<Tile>> hands = new LinkedHashMap<>();
    /** Whether each player has had an opening play accepted. */
    private final Map<String, Boolean> openingMeldCompleted = new LinkedHashMap<>();
    private int currentPlayerIndex;
    private boolean terminal;
    private String winnerId;

    /**
     * Creates a game state from explicit parts; useful for tests and restored games.
     *
     * @param playerIds player ids in seating order (at least one, no duplicates)
     * @param board     the starting board
     * @param drawPile  the draw pile
     * @param hands     the starting hand of every player
     * @throws IllegalArgumentException if players are missing, duplicated or lack a hand
     */
    public GameState(List<String> playerIds, Board board, TileDeck drawPile, Map<String, List<Tile>> hands) {
        Objects.requireNonNull(playerIds, "playerIds");
        Objects.requireNonNull(hands, "hands");
        if (playerIds.isEmpty()) {
            throw new IllegalArgumentException("A game needs at least one player");
        }
        this.playerIds = List.copyOf(playerIds);
        this.board = Objects.requireNonNull(board, "board").copy();
        this.drawPile = Objects.requireNonNull(drawPile, "drawPile");
        for (String id : this.playerIds) {
            if (this.hands.containsKey(id)) {
                throw new IllegalArgumentException("Duplicate player id: " + id);
            }
            List<Tile> hand = hands.get(id);
            if (hand == null) {
                throw new IllegalArgumentException("No hand given for player " + id);
            }
            this.hands.put(id, new ArrayList<>(hand));
            this.openingMeldCompleted.put(id, false);
        }
        this.currentPlayerIndex = 0;
    }

    /**
     * Deals {@code handSize} tiles from the deck to each player in seating order; whatever is
     * left becomes the draw pile. The board starts empty and player 0 moves first.
     *
     * @param playerIds player ids in seating order
     * @param deck      the shuffled deck; it becomes the draw pile
     * @param handSize  tiles per hand
     * @return the initial state
     */
    public static GameState deal(List<String> playerIds, TileDeck deck, int handSize) {
        Map<String, List<Tile>> hands = new LinkedHashMap<>();
        for (String id : playerIds) {
            hands.put(id, deck.draw(handSize));
        }
        return new GameState(playerIds, new Board(), deck, hands);
    }

    public List<String> getPlayerIds() {
        return playerIds;
    }

    public int getPlayerCount() {
        return playerIds.size();
    }

    /**
     * Returns an independent copy of the canonical board.
     */
    public Board getBoard() {
        return board.copy();
    }

    /**
     * Returns an unmodifiable copy of the player's hand; later turns do not change it.
     *
     * @throws IllegalArgumentException for an unknown player
     */
    public List<Tile> getHand(String playerId) {
        return List.copyOf(handOf(playerId));
    }

    public int getHandSize(String playerId) {
        return handOf(playerId).size();
    }

    public int getDrawPileSize() {
        return drawPile.size();
    }

    public int getCurrentPlayerIndex() {
        return currentPlayerIndex;
    }

    public String getCurrentPlayerId() {
        return playerIds.get(currentPlayerIndex);
    }

    public boolean isOpeningMeldCompleted(String playerId) {
        handOf(playerId);
        return openingMeldCompleted.get(playerId);
    }

    public boolean isTerminal() {
        return terminal;
    }

    public Optional<String> getWinnerId() {
        return Optional.ofNullable(winnerId);
    }

    /**
     * Counts every tile in play: board, hands and draw pile. Constant over a whole game.
     */
    public int totalTiles() {
        int total = board.tileCount() + drawPile.size();
        for (List<Tile> hand : hands.values()) {
            total += hand.size();
        }
        return total;
    }

    /**
     * Captures the full state as an immutable value.
     */
    public GameSnapshot snapshot() {
        return new GameSnapshot(board, hands, drawPile.asUnmodifiableList(), currentPlayerIndex,
                openingMeldCompleted, terminal, winnerId);
    }

    // ---------------------------------------------------------------------------------------------
    // Mutators used by TurnEngine
    // ---------------------------------------------------------------------------------------------

    Board board() {
        return board;
    }

    void replaceBoard(Board newBoard) {
        this.board = newBoard.copy();
    }

    /**
     * Moves up to {@code count} tiles from the draw pile into the player's hand.
     *
     * @return how many tiles were actually drawn
     */
    int drawInto(String playerId, int count) {
        List<Tile> drawn = drawPile.draw(count);
        handOf(playerId).addAll(drawn);
        return drawn.size();
    }

    void removeFromHand(String playerId, List<Tile> tiles) {
        handOf(playerId).removeAll(tiles);
    }

    void markOpeningMeldCompleted(String playerId) {
        openingMeldCompleted.put(playerId, true);
    }

    void declareWinner(String playerId) {
        this.terminal = true;
        this.winnerId = playerId;
    }

    void advanceTurn() {
        currentPlayerIndex = (currentPlayerIndex + 1) % playerIds.size();
    }

    private List<Tile> handOf(String playerId) {
        List<Tile> hand = hands.get(playerId);
        if (hand == null) {
            throw new IllegalArgumentException("Unknown player: " + playerId);
        }
        return hand;
    }
}
