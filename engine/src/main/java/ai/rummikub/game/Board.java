package ai.rummikub.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The shared table: an ordered sequence of {@link Meld}s.
 * <p>
 * A board is valid when every meld on it is valid. Boards handed to players are always
 * independent copies (see {@link #copy()}); only the turn engine replaces the canonical board,
 * so a player may freely rearrange the board it receives when preparing a proposal.
 */
public class Board {
    /** Melds in table order. */
    private final List<Meld> melds = new ArrayList<>();

    /**
     * Creates an empty board.
     */
    public Board() {
    }

    /**
     * Creates a board holding the given melds, in order.
     *
     * @param melds the melds to place (must not be null)
     */
    public Board(List<Meld> melds) {
        Objects.requireNonNull(melds, "melds");
        for (Meld meld : melds) {
            addMeld(meld);
        }
    }

    /**
     * Creates an independent copy of this board.
     * <p>
     * The meld list is copied; melds and tiles are immutable and therefore shared, so tile
     * identities are preserved.
     *
     * @return a new board with the same melds
     */
    public Board copy() {
        return new Board(melds);
    }

    /**
     * Appends a meld to the end of the board.
     *
     * @param meld the meld to add (must not be null)
     */
    public void addMeld(Meld meld) {
        melds.add(Objects.requireNonNull(meld, "meld"));
    }

    /**
     * Returns an unmodifiable view of the melds on this board.
     */
    public List<Meld> getMelds() {
        return Collections.unmodifiableList(melds);
    }

    /**
     * Returns {@code true} if every meld on the board validates. An empty board is valid.
     */
    public boolean isValid() {
        for (Meld meld : melds) {
            if (!meld.validate()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Flattens the board into a list of tiles, meld by meld.
     *
     * @return a new list containing every tile on the board
     */
    public List<Tile> getAllTiles() {
        List<Tile> all = new ArrayList<>();
        for (Meld meld : melds) {
            all.addAll(meld.getTiles());
        }
        return all;
    }

    /**
     * Returns {@code true} if some tile (by identity) appears more than once on the board.
     */
    public boolean hasDuplicateTiles() {
        Set<Tile> seen = new HashSet<>();
        for (Meld meld : melds) {
            for (Tile tile : meld.getTiles()) {
                if (!seen.add(tile)) {
                    return true;
                }
            }
        }
        return false;
    }

    public int tileCount() {
        int count = 0;
        for (Meld meld : melds) {
            count += meld.size();
        }
        return count;
    }

    public int size() {
        return melds.size();
    }

    public boolean isEmpty() {
        return melds.isEmpty();
    }

    /**
     * Renders one meld per line, optionally with ANSI colours.
     *
     * @param coloured whether to colourise the tiles for terminal display
     * @return the rendered board, or "(empty board)"
     */
    public String render(boolean coloured) {
        if (melds.isEmpty()) {
            return "(empty board)";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < melds.size(); i++) {
            Meld meld = melds.get(i);
            sb.append('M').append(i + 1).append(": ");
            for (Tile tile : meld.getTiles()) {
                sb.append(coloured ? tile.toColouredString() : tile.shortName()).append(' ');
            }
            sb.append('(').append(meld.classify().name().toLowerCase()).append(')');
            if (i < melds.size() - 1) {
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return render(false);
    }
}
