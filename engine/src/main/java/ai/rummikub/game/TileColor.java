package ai.rummikub.game;

/**
 * Enumeration of the tile colours, plus the marker carried by wildcard tiles.
 * <p>
 * Numbered tiles come in four colours, each with values 1 to 13. A run must stay within
 * one colour and a group must use pairwise-distinct colours, so the colour is the main
 * axis along which melds are validated. Wildcards carry {@link #WILDCARD} instead of a real
 * colour and take on whatever colour a meld needs.
 * <p>
 * This enum also provides ANSI colour formatting for terminal display.
 */
public enum TileColor {
    /** Black tiles, rendered in the default terminal colour. */
    BLACK("K", ""),
    /** Red tiles. */
    RED("R", "\u001B[31m"),
    /** Blue tiles. */
    BLUE("B", "\u001B[34m"),
    /** Orange tiles, rendered in yellow since terminals have no orange. */
    ORANGE("O", "\u001B[33m"),
    /** Marker colour of wildcard (joker) tiles. */
    WILDCARD("J", "\u001B[35m");

    /** ANSI escape code to reset text formatting in terminals. */
    private static final String ANSI_RESET = "\u001B[0m";

    /** One-letter code used in short names and logs (e.g. "R" in "R7"). */
    private final String code;
    /** ANSI prefix for terminal output; empty for the default colour. */
    private final String ansi;

    TileColor(String code, String ansi) {
        this.code = code;
        this.ansi = ansi;
    }

    /**
     * Returns the one-letter code of this colour.
     *
     * @return the colour code (e.g., "K", "R", "B", "O", "J")
     */
    public String getCode() {
        return code;
    }

    /**
     * Checks whether this is the wildcard marker rather than a playable colour.
     *
     * @return {@code true} for {@link #WILDCARD}
     */
    public boolean isWildcard() {
        return this == WILDCARD;
    }

    /**
     * Wraps the given value in this colour's ANSI codes.
     *
     * @param value the string to colourise
     * @return the coloured string, or the value unchanged for black tiles
     */
    public String colourise(String value) {
        if (ansi.isEmpty()) {
            return value;
        }
        return ansi + value + ANSI_RESET;
    }

    /**
     * Returns the four colours numbered tiles can have, in canonical order.
     *
     * @return the playable colours (everything except {@link #WILDCARD})
     */
    public static TileColor[] playable() {
        return new TileColor[]{BLACK, RED, BLUE, ORANGE};
    }

    /**
     * Parses a one-letter colour code.
     *
     * @param code the code (case-insensitive)
     * @return the matching colour
     * @throws IllegalArgumentException if no colour uses that code
     */
    public static TileColor fromCode(String code) {
        if (code != null) {
            for (TileColor color : values()) {
                if (color.code.equalsIgnoreCase(code.trim())) {
                    return color;
                }
            }
        }
        throw new IllegalArgumentException("Unknown tile colour code: " + code);
    }

    @Override
    public String toString() {
        return code;
    }
}
