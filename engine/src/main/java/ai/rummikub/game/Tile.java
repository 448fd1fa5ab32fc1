package ai.rummikub.game;

import java.util.Comparator;
import java.util.Objects;
import java.util.UUID;

/**
 * A single physical tile: a numbered tile with a {@link TileColor} and a value from 1 to 13,
 * or a wildcard.
 * <p>
 * Tiles are immutable. Every tile carries an opaque unique id, and {@link #equals(Object)}
 * compares ids, so two Red 5s from different copies of the set are distinct tiles that can be
 * tracked separately through the deck, hands and board. Use {@link #isInterchangeableWith(Tile)}
 * to ask whether two tiles play the same role in a meld.
 */
public final class Tile {
    /** Lowest face value of a numbered tile. */
    public static final int MIN_VALUE = 1;
    /** Highest face value of a numbered tile. */
    public static final int MAX_VALUE = 13;
    /** Value carried by wildcards, which have no face value until a meld assigns them a role. */
    public static final int WILDCARD_VALUE = 0;

    /**
     * Canonical order used by the solver: value ascending, then colour, wildcards last.
     * Ties between interchangeable tiles are broken by id so the order is total.
     */
    public static final Comparator<Tile> CANONICAL_ORDER = Comparator
            .comparing(Tile::isWildcard)
            .thenComparingInt(Tile::getValue)
            .thenComparing(Tile::getColor)
            .thenComparing(Tile::getId);

    private final String id;
    private final TileColor color;
    private final int value;

    /**
     * Creates a tile with a fresh random id.
     *
     * @param color the colour, or {@link TileColor#WILDCARD} for a wildcard
     * @param value the face value; ignored for wildcards
     * @throws MalformedTileException if a numbered tile's value is outside [1,13]
     */
    public Tile(TileColor color, int value) {
        this(UUID.randomUUID().toString(), color, value);
    }

    /**
     * Creates a tile with an explicit id.
     *
     * @param id    unique identifier of this physical tile
     * @param color the colour, or {@link TileColor#WILDCARD} for a wildcard
     * @param value the face value; ignored for wildcards
     * @throws MalformedTileException if a numbered tile's value is outside [1,13]
     */
    public Tile(String id, TileColor color, int value) {
        this.id = Objects.requireNonNull(id, "id");
        this.color = Objects.requireNonNull(color, "color");
        if (color.isWildcard()) {
            this.value = WILDCARD_VALUE;
        } else {
            if (value < MIN_VALUE || value > MAX_VALUE) {
                throw new MalformedTileException(color, value);
            }
            this.value = value;
        }
    }

    /**
     * Creates a wildcard with a fresh random id.
     */
    public static Tile wildcard() {
        return new Tile(TileColor.WILDCARD, WILDCARD_VALUE);
    }

    /**
     * Creates a wildcard with an explicit id.
     */
    public static Tile wildcard(String id) {
        return new Tile(id, TileColor.WILDCARD, WILDCARD_VALUE);
    }

    public String getId() {
        return id;
    }

    public TileColor getColor() {
        return color;
    }

    /**
     * Returns the face value, or {@link #WILDCARD_VALUE} for a wildcard.
     */
    public int getValue() {
        return value;
    }

    public boolean isWildcard() {
        return color.isWildcard();
    }

    /**
     * Checks whether the two tiles are interchangeable in any meld: both wildcards, or the
     * same colour and value. Identity is not compared.
     *
     * @param other the tile to compare with
     * @return {@code true} if swapping the two tiles never changes a meld's validity
     */
    public boolean isInterchangeableWith(Tile other) {
        if (other == null) {
            return false;
        }
        if (isWildcard() && other.isWildcard()) {
            return true;
        }
        return color == other.color && value == other.value;
    }

    /**
     * Returns a key shared by exactly the tiles interchangeable with this one.
     *
     * @return the short name without identity (e.g. "R5", "J")
     */
    public String typeKey() {
        return isWildcard() ? color.getCode() : color.getCode() + value;
    }

    /**
     * Returns an interchangeable tile with a fresh identity. Used when duplicating tiles for
     * simulation, never for moving a tile between deck, hand and board.
     */
    public Tile copy() {
        return new Tile(color, value);
    }

    /**
     * Returns the short, non-coloured name of this tile (e.g., "R5", "O13", "J").
     */
    public String shortName() {
        return typeKey();
    }

    /**
     * Returns the short name wrapped in ANSI colour codes for terminal display.
     */
    public String toColouredString() {
        return color.colourise(shortName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Tile)) {
            return false;
        }
        Tile tile = (Tile) o;
        return id.equals(tile.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return shortName();
    }
}
