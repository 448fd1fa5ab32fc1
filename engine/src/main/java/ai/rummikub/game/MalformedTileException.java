package ai.rummikub.game;

/**
 * Thrown when a numbered tile is constructed with a value outside the table range.
 * <p>
 * No tile is produced when this is thrown, so malformed tiles never reach a deck, hand or board.
 */
public class MalformedTileException extends IllegalArgumentException {

    private final TileColor color;
    private final int value;

    public MalformedTileException(TileColor color, int value) {
        super("Tile value " + value + " for colour " + color.name()
                + " is outside [" + Tile.MIN_VALUE + "," + Tile.MAX_VALUE + "]");
        this.color = color;
        this.value = value;
    }

    public TileColor getColor() {
        return color;
    }

    public int getValue() {
        return value;
    }
}
