package ai.rummikub.turn;

import java.util.Optional;

/**
 * How a single turn resolved.
 * <p>
 * Rejections are data, not exceptions: a rejected play carries its {@link RejectionReason}
 * and the number of penalty tiles drawn, and the game carries on.
 */
public final class TurnOutcome {

    /** Resolution of a turn. */
    public enum Kind {
        /** The player drew a tile (or the pile was empty). */
        DREW,
        /** The play was accepted and the board replaced. */
        COMMITTED,
        /** The play was refused and the penalty applied. */
        REJECTED,
        /** The proposal never arrived; the same player is still to move. */
        ABANDONED
    }

    private final Kind kind;
    private final String playerId;
    private final RejectionReason reason;
    private final int tilesDrawn;
    private final int tilesPlayed;
    private final boolean gameOver;

    private TurnOutcome(Kind kind, String playerId, RejectionReason reason,
                        int tilesDrawn, int tilesPlayed, boolean gameOver) {
        this.kind = kind;
        this.playerId = playerId;
        this.reason = reason;
        this.tilesDrawn = tilesDrawn;
        this.tilesPlayed = tilesPlayed;
        this.gameOver = gameOver;
    }

    static TurnOutcome drew(String playerId, int tilesDrawn) {
        return new TurnOutcome(Kind.DREW, playerId, null, tilesDrawn, 0, false);
    }

    static TurnOutcome committed(String playerId, int tilesPlayed, boolean gameOver) {
        return new TurnOutcome(Kind.COMMITTED, playerId, null, 0, tilesPlayed, gameOver);
    }

    static TurnOutcome rejected(String playerId, RejectionReason reason, int penaltyDrawn) {
        return new TurnOutcome(Kind.REJECTED, playerId, reason, penaltyDrawn, 0, false);
    }

    static TurnOutcome abandoned(String playerId) {
        return new TurnOutcome(Kind.ABANDONED, playerId, null, 0, 0, false);
    }

    public Kind getKind() {
        return kind;
    }

    public String getPlayerId() {
        return playerId;
    }

    /**
     * Returns the reason for a {@link Kind#REJECTED} outcome; empty otherwise.
     */
    public Optional<RejectionReason> getReason() {
        return Optional.ofNullable(reason);
    }

    /**
     * Tiles added to the hand: 1 (or 0) for a draw, the penalty for a rejection.
     */
    public int getTilesDrawn() {
        return tilesDrawn;
    }

    public int getTilesPlayed() {
        return tilesPlayed;
    }

    /**
     * {@code true} when this turn emptied the player's hand and ended the game.
     */
    public boolean isGameOver() {
        return gameOver;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name()).append('(').append(playerId);
        if (reason != null) {
            sb.append(", ").append(reason);
        }
        if (tilesDrawn > 0) {
            sb.append(", drew=").append(tilesDrawn);
        }
        if (tilesPlayed > 0) {
            sb.append(", played=").append(tilesPlayed);
        }
        if (gameOver) {
            sb.append(", game over");
        }
        return sb.append(')').toString();
    }
}
