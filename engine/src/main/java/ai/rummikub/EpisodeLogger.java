package ai.rummikub;

import ai.rummikub.game.Meld;
import ai.rummikub.game.Tile;
import ai.rummikub.turn.GameSnapshot;
import ai.rummikub.turn.TurnOutcome;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Responsible for emitting structured JSON logs of whole games.
 *
 * <p>One {@code EPISODE_TURN} line per resolved turn, carrying the game state after the turn, and
 * one {@code EPISODE_SUMMARY} line per game. Enabled with {@code -Dlog.episodes=true}.</p>
 */
public class EpisodeLogger {
    private static final Logger log = LoggerFactory.getLogger(EpisodeLogger.class);
    private static final boolean ENABLED = Boolean.getBoolean("log.episodes");

    /**
     * Return true if episode logging is enabled via -Dlog.episodes=true.
     */
    public static boolean isEnabled() {
        return ENABLED;
    }

    /**
     * Emit a single JSON line describing one resolved turn and the state it left behind.
     *
     * <p>The state fields follow the persisted game-state shape: {@code board} (a list of melds,
     * each a list of tiles), {@code hands}, {@code draw_pile}, {@code current_player_index},
     * {@code opening_meld_completed}, {@code terminal} and {@code winner_id}. A tile is written as
     * {@code {"id":..,"color":..,"value":..}} with colour {@code WILDCARD} and value 0 for
     * wildcards. {@code draw_pile_size} is kept for quick filtering.
     */
    public static void logTurn(int turnIndex, TurnOutcome outcome, GameSnapshot after) {
        try {
            String line = turnLine(turnIndex, outcome, after);
            if (log.isInfoEnabled()) {
                log.info("EPISODE_TURN {}", line);
            }
        } catch (Exception e) {
            // Logging must never interfere with gameplay.
            if (log.isDebugEnabled()) {
                log.debug("Failed to log episode turn", e);
            }
        }
    }

    static String turnLine(int turnIndex, TurnOutcome outcome, GameSnapshot after) {
        StringBuilder sb = new StringBuilder();
        sb.append("{\"type\":\"turn\"");
        sb.append(",\"turn_index\":").append(turnIndex);
        sb.append(",\"player_id\":\"").append(outcome.getPlayerId()).append('"');
        sb.append(",\"outcome\":\"").append(outcome.getKind()).append('"');
        outcome.getReason().ifPresent(reason ->
                sb.append(",\"reason\":\"").append(reason.name()).append('"'));
        sb.append(",\"tiles_drawn\":").append(outcome.getTilesDrawn());
        sb.append(",\"tiles_played\":").append(outcome.getTilesPlayed());

        sb.append(",\"board\":[");
        List<Meld> melds = after.board().getMelds();
        for (int i = 0; i < melds.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            appendTiles(sb, melds.get(i).getTiles());
        }
        sb.append(']');

        sb.append(",\"hands\":{");
        boolean first = true;
        for (Map.Entry<String, List<Tile>> hand : after.hands().entrySet()) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            sb.append('"').append(hand.getKey()).append("\":");
            appendTiles(sb, hand.getValue());
        }
        sb.append('}');

        sb.append(",\"draw_pile\":");
        appendTiles(sb, after.drawPile());
        sb.append(",\"draw_pile_size\":").append(after.drawPile().size());
        sb.append(",\"current_player_index\":").append(after.currentPlayerIndex());

        sb.append(",\"opening_meld_completed\":{");
        first = true;
        for (Map.Entry<String, Boolean> flag : after.openingMeldCompleted().entrySet()) {
            if (!first) {
                sb.append(',');
            }
            first = false;
            sb.append('"').append(flag.getKey()).append("\":").append(flag.getValue());
        }
        sb.append('}');

        sb.append(",\"terminal\":").append(after.terminal());
        sb.append(",\"winner_id\":");
        if (after.winnerId() == null) {
            sb.append("null");
        } else {
            sb.append('"').append(after.winnerId()).append('"');
        }
        sb.append('}');
        return sb.toString();
    }

    /**
     * Emit a single structured JSON line summarising the whole game.
     */
    public static void logSummary(List<String> playerIds, String winnerId, int turns, long durationNanos) {
        try {
            StringBuilder sb = new StringBuilder();
            sb.append("{\"type\":\"summary\"");
            sb.append(",\"players\":[");
            for (int i = 0; i < playerIds.size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                sb.append('"').append(playerIds.get(i)).append('"');
            }
            sb.append(']');
            sb.append(",\"winner_id\":");
            if (winnerId == null) {
                sb.append("null");
            } else {
                sb.append('"').append(winnerId).append('"');
            }
            sb.append(",\"turns\":").append(turns);
            sb.append(",\"duration_nanos\":").append(durationNanos);
            sb.append('}');

            if (log.isInfoEnabled()) {
                log.info("EPISODE_SUMMARY {}", sb);
            }
        } catch (Exception e) {
            if (log.isDebugEnabled()) {
                log.debug("Failed to log episode summary", e);
            }
        }
    }

    private static void appendTiles(StringBuilder sb, List<Tile> tiles) {
        sb.append('[');
        for (int i = 0; i < tiles.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            Tile tile = tiles.get(i);
            sb.append("{\"id\":\"").append(tile.getId()).append('"');
            sb.append(",\"color\":\"").append(tile.getColor().name()).append('"');
            sb.append(",\"value\":").append(tile.getValue()).append('}');
        }
        sb.append(']');
    }
}
