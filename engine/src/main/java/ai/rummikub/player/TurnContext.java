package ai.rummikub.player;

import ai.rummikub.game.Board;
import ai.rummikub.game.Tile;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a player is shown when asked for a proposal.
 * <p>
 * Built fresh by the turn engine for every turn. The board and hand are copies, so a player
 * can rearrange them while searching without touching the game.
 */
public final class TurnContext {
    private final String playerId;
    private final Board board;
    private final List<Tile> hand;
    private final boolean openingMeldCompleted;
    private final int openingThreshold;
    private final Map<String, Integer> opponentHandSizes;
    private final int drawPileSize;

    public TurnContext(String playerId, Board board, List<Tile> hand, boolean openingMeldCompleted,
                       int openingThreshold, Map<String, Integer> opponentHandSizes, int drawPileSize) {
        this.playerId = playerId;
        this.board = board.copy();
        this.hand = new ArrayList<>(hand);
        this.openingMeldCompleted = openingMeldCompleted;
        this.openingThreshold = openingThreshold;
        this.opponentHandSizes = Collections.unmodifiableMap(new LinkedHashMap<>(opponentHandSizes));
        this.drawPileSize = drawPileSize;
    }

    public String getPlayerId() {
        return playerId;
    }

    /**
     * Returns this context's copy of the board.
     */
    public Board getBoard() {
        return board;
    }

    /**
     * Returns this context's copy of the player's hand.
     */
    public List<Tile> getHand() {
        return hand;
    }

    public boolean isOpeningMeldCompleted() {
        return openingMeldCompleted;
    }

    public int getOpeningThreshold() {
        return openingThreshold;
    }

    /**
     * Hand sizes of the other players, in seating order.
     */
    public Map<String, Integer> getOpponentHandSizes() {
        return opponentHandSizes;
    }

    public int getDrawPileSize() {
        return drawPileSize;
    }
}
