package ai.rummikub.turn;

import ai.rummikub.game.Board;
import ai.rummikub.game.Tile;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * What a player wants to do with its turn: draw a tile, or play by replacing the board with
 * {@code newBoard} while moving {@code claimedTiles} out of its hand.
 */
public final class TurnProposal {

    /** The two kinds of proposal. */
    public enum Kind {
        DRAW,
        PLAY
    }

    private static final TurnProposal DRAW = new TurnProposal(Kind.DRAW, null, Collections.emptyList());

    private final Kind kind;
    private final Board newBoard;
    private final List<Tile> claimedTiles;

    private TurnProposal(Kind kind, Board newBoard, List<Tile> claimedTiles) {
        this.kind = kind;
        this.newBoard = newBoard;
        this.claimedTiles = claimedTiles;
    }

    public static TurnProposal draw() {
        return DRAW;
    }

    /**
     * Creates a Play proposal.
     *
     * @param newBoard     the complete board after the play (may be null; the engine rejects it)
     * @param claimedTiles the hand tiles that end up on the board
     */
    public static TurnProposal play(Board newBoard, List<Tile> claimedTiles) {
        Objects.requireNonNull(claimedTiles, "claimedTiles");
        return new TurnProposal(Kind.PLAY, newBoard, List.copyOf(claimedTiles));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isDraw() {
        return kind == Kind.DRAW;
    }

    /**
     * Returns the proposed board, or {@code null} for a draw.
     */
    public Board getNewBoard() {
        return newBoard;
    }

    /**
     * Returns the tiles claimed from the hand; empty for a draw.
     */
    public List<Tile> getClaimedTiles() {
        return claimedTiles;
    }

    @Override
    public String toString() {
        if (kind == Kind.DRAW) {
            return "DRAW";
        }
        return "PLAY(claimed=" + claimedTiles + ", melds=" + (newBoard == null ? "null" : newBoard.size()) + ")";
    }
}
