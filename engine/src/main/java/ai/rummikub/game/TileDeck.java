package ai.rummikub.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * The full set of tiles used in a game and, once dealt, the face-down draw pile.
 * <p>
 * The standard set is two copies of every value 1–13 in each of the four colours plus two
 * wildcards, 106 tiles in total. The deck is shuffled on construction; tiles are drawn from the
 * end of the list.
 */
public class TileDeck {
    /** Copies of each colour/value pair in the standard set. */
    public static final int COPIES_PER_TILE = 2;
    /** Wildcards in the standard set. */
    public static final int WILDCARDS = 2;
    /** Size of the standard set. */
    public static final int STANDARD_SIZE =
            COPIES_PER_TILE * TileColor.playable().length * Tile.MAX_VALUE + WILDCARDS;

    /** The tiles currently in the deck; the last element is the next to be drawn. */
    private final List<Tile> tiles = new ArrayList<>();
    private final Random random;

    /**
     * Constructs a standard deck and shuffles it.
     */
    public TileDeck() {
        this(new Random());
    }

    /**
     * Constructs a standard deck and shuffles it with the given source of randomness.
     *
     * @param random used for shuffling; pass a seeded instance for reproducible games
     */
    public TileDeck(Random random) {
        this.random = random;
        reset();
    }

    /**
     * Constructs a deck holding exactly the given tiles, in order, without shuffling.
     * The last tile of the list is drawn first.
     *
     * @param tiles the tiles to stack
     */
    public TileDeck(List<Tile> tiles) {
        this.random = new Random();
        this.tiles.addAll(tiles);
    }

    /**
     * Shuffles the tiles remaining in the deck.
     */
    public void shuffle() {
        Collections.shuffle(tiles, random);
    }

    /**
     * Draws and removes the last tile of the deck.
     *
     * @return the drawn tile, or {@code null} if the deck is empty
     */
    public Tile draw() {
        if (tiles.isEmpty()) {
            return null;
        }
        return tiles.remove(tiles.size() - 1);
    }

    /**
     * Draws up to {@code count} tiles; fewer are returned if the deck runs out.
     *
     * @param count number of tiles wanted
     * @return the drawn tiles in draw order
     */
    public List<Tile> draw(int count) {
        List<Tile> drawn = new ArrayList<>(count);
        for (int i = 0; i < count && !tiles.isEmpty(); i++) {
            drawn.add(draw());
        }
        return drawn;
    }

    public int size() {
        return tiles.size();
    }

    public boolean isEmpty() {
        return tiles.isEmpty();
    }

    /**
     * Returns an unmodifiable view of the tiles in the deck, bottom first.
     */
    public List<Tile> asUnmodifiableList() {
        return Collections.unmodifiableList(tiles);
    }

    /**
     * Resets the deck to a freshly shuffled standard set with new tile identities.
     */
    public final void reset() {
        tiles.clear();
        for (TileColor color : TileColor.playable()) {
            for (int value = Tile.MIN_VALUE; value <= Tile.MAX_VALUE; value++) {
                for (int copy = 0; copy < COPIES_PER_TILE; copy++) {
                    tiles.add(new Tile(color, value));
                }
            }
        }
        for (int i = 0; i < WILDCARDS; i++) {
            tiles.add(Tile.wildcard());
        }
        shuffle();
    }

    @Override
    public String toString() {
        return "TileDeck(size=" + tiles.size() + ")";
    }
}
