package ai.rummikub.game;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An ordered list of tiles placed together on the board.
 * <p>
 * A meld is valid when it is either a {@link MeldType#GROUP} or a {@link MeldType#RUN}:
 * <ul>
 *   <li><strong>Group:</strong> 3 or 4 tiles; every numbered tile has the same value and the
 *       colours are pairwise distinct. Wildcards fill the missing colours.</li>
 *   <li><strong>Run:</strong> numbered tiles share one colour and, sorted by value, can be made
 *       consecutive by putting wildcards into the gaps. Leftover wildcards extend either end,
 *       but the run never leaves the range [1,13].</li>
 * </ul>
 * Melds may be constructed with fewer than three tiles (a player can propose one); such melds
 * simply never validate. Instances are immutable.
 */
public final class Meld {
    /** Smallest number of tiles in any valid meld. */
    public static final int MIN_SIZE = 3;
    /** Largest group: one tile per colour. */
    public static final int MAX_GROUP_SIZE = 4;

    private final List<Tile> tiles;

    /**
     * Creates a meld from the given tiles, keeping their order.
     *
     * @param tiles the tiles (must not be null or contain null)
     */
    public Meld(List<Tile> tiles) {
        Objects.requireNonNull(tiles, "tiles");
        List<Tile> copy = new ArrayList<>(tiles.size());
        for (Tile tile : tiles) {
            copy.add(Objects.requireNonNull(tile, "tile"));
        }
        this.tiles = Collections.unmodifiableList(copy);
    }

    public static Meld of(Tile... tiles) {
        return new Meld(Arrays.asList(tiles));
    }

    /**
     * Returns the tiles of this meld in their original order.
     *
     * @return an unmodifiable list of tiles
     */
    public List<Tile> getTiles() {
        return tiles;
    }

    public int size() {
        return tiles.size();
    }

    public boolean contains(Tile tile) {
        return tiles.contains(tile);
    }

    /**
     * Returns {@code true} if this meld is a valid group or a valid run.
     */
    public boolean validate() {
        return classify() != MeldType.INVALID;
    }

    /**
     * Derives the type of this meld. A meld that qualifies as both (for example, three
     * wildcards) is reported as a group.
     *
     * @return {@link MeldType#GROUP}, {@link MeldType#RUN} or {@link MeldType#INVALID}
     */
    public MeldType classify() {
        if (tiles.size() < MIN_SIZE) {
            return MeldType.INVALID;
        }
        if (isValidGroup(tiles)) {
            return MeldType.GROUP;
        }
        if (isValidRun(tiles)) {
            return MeldType.RUN;
        }
        return MeldType.INVALID;
    }

    /**
     * Sum of the face values of the numbered tiles; wildcards count 0.
     */
    public int faceValue() {
        return faceValue(tiles);
    }

    /**
     * Sum of the face values of the given tiles; wildcards count 0.
     *
     * @param tiles the tiles to score
     * @return the face-value total
     */
    public static int faceValue(List<Tile> tiles) {
        int total = 0;
        for (Tile tile : tiles) {
            if (!tile.isWildcard()) {
                total += tile.getValue();
            }
        }
        return total;
    }

    static boolean isValidGroup(List<Tile> tiles) {
        if (tiles.size() > MAX_GROUP_SIZE) {
            return false;
        }
        int baseValue = -1;
        Set<TileColor> colors = EnumSet.noneOf(TileColor.class);
        for (Tile tile : tiles) {
            if (tile.isWildcard()) {
                continue;
            }
            if (baseValue == -1) {
                baseValue = tile.getValue();
            } else if (tile.getValue() != baseValue) {
                return false;
            }
            if (!colors.add(tile.getColor())) {
                return false;
            }
        }
        return true;
    }

    static boolean isValidRun(List<Tile> tiles) {
        List<Tile> numbered = new ArrayList<>(tiles.size());
        int wildcards = 0;
        for (Tile tile : tiles) {
            if (tile.isWildcard()) {
                wildcards++;
            } else {
                numbered.add(tile);
            }
        }
        if (numbered.isEmpty()) {
            // All wildcards: any length that fits on the table.
            return wildcards <= Tile.MAX_VALUE;
        }

        TileColor runColor = numbered.get(0).getColor();
        for (Tile tile : numbered) {
            if (tile.getColor() != runColor) {
                return false;
            }
        }

        numbered.sort((a, b) -> Integer.compare(a.getValue(), b.getValue()));
        for (int i = 0; i < numbered.size() - 1; i++) {
            int gap = numbered.get(i + 1).getValue() - numbered.get(i).getValue() - 1;
            if (gap < 0) {
                return false;
            }
            if (gap > wildcards) {
                return false;
            }
            wildcards -= gap;
        }

        int minVal = numbered.get(0).getValue();
        int maxVal = numbered.get(numbered.size() - 1).getValue();
        return wildcards <= (minVal - Tile.MIN_VALUE) + (Tile.MAX_VALUE - maxVal);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Meld)) {
            return false;
        }
        return tiles.equals(((Meld) o).tiles);
    }

    @Override
    public int hashCode() {
        return tiles.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < tiles.size(); i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(tiles.get(i).shortName());
        }
        return sb.append(']').toString();
    }
}
