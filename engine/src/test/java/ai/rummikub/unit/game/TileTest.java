package ai.rummikub.unit.game;

import static org.junit.jupiter.api.Assertions.*;

import ai.rummikub.game.MalformedTileException;
import ai.rummikub.game.Tile;
import ai.rummikub.game.TileColor;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Construction rules, identity and interchangeability of tiles.
 */
class TileTest {

    @Test
    void valuesOutsideOneToThirteenAreRejected() {
        assertThrows(MalformedTileException.class, () -> new Tile(TileColor.RED, 0));
        assertThrows(MalformedTileException.class, () -> new Tile(TileColor.BLUE, 14));
        assertThrows(MalformedTileException.class, () -> new Tile("x", TileColor.ORANGE, -3));

        MalformedTileException e = assertThrows(MalformedTileException.class,
                () -> new Tile(TileColor.BLACK, 20));
        assertEquals(TileColor.BLACK, e.getColor());
        assertEquals(20, e.getValue());
    }

    @Test
    void boundaryValuesAreAccepted() {
        assertEquals(1, new Tile(TileColor.RED, 1).getValue());
        assertEquals(13, new Tile(TileColor.RED, 13).getValue());
    }

    @Test
    void wildcardIgnoresValue() {
        Tile wildcard = new Tile(TileColor.WILDCARD, 99);
        assertTrue(wildcard.isWildcard());
        assertEquals(Tile.WILDCARD_VALUE, wildcard.getValue());
        assertEquals("J", wildcard.shortName());
    }

    @Test
    void nullColourIsRejected() {
        assertThrows(NullPointerException.class, () -> new Tile(null, 5));
    }

    @Test
    void equalityIsByIdentity() {
        Tile a = new Tile("a", TileColor.RED, 5);
        Tile b = new Tile("b", TileColor.RED, 5);
        Tile sameIdAsA = new Tile("a", TileColor.RED, 5);

        assertNotEquals(a, b);
        assertEquals(a, sameIdAsA);
        assertEquals(a.hashCode(), sameIdAsA.hashCode());
    }

    @Test
    void interchangeabilityIgnoresIdentity() {
        Tile red5 = new Tile(TileColor.RED, 5);
        Tile otherRed5 = new Tile(TileColor.RED, 5);
        Tile blue5 = new Tile(TileColor.BLUE, 5);

        assertTrue(red5.isInterchangeableWith(otherRed5));
        assertFalse(red5.isInterchangeableWith(blue5));
        assertTrue(Tile.wildcard().isInterchangeableWith(Tile.wildcard()));
        assertFalse(Tile.wildcard().isInterchangeableWith(red5));
        assertFalse(red5.isInterchangeableWith(null));
    }

    @Test
    void copyHasFreshIdentity() {
        Tile original = new Tile(TileColor.ORANGE, 9);
        Tile copy = original.copy();

        assertNotEquals(original, copy);
        assertNotEquals(original.getId(), copy.getId());
        assertTrue(original.isInterchangeableWith(copy));
    }

    @Test
    void canonicalOrderPutsWildcardsLast() {
        Tile wildcard = Tile.wildcard();
        Tile red2 = new Tile(TileColor.RED, 2);
        Tile black2 = new Tile(TileColor.BLACK, 2);
        Tile blue1 = new Tile(TileColor.BLUE, 1);

        List<Tile> tiles = new ArrayList<>(List.of(wildcard, red2, black2, blue1));
        tiles.sort(Tile.CANONICAL_ORDER);

        assertEquals(List.of(blue1, black2, red2, wildcard), tiles);
    }

    @Test
    void shortNamesUseColourCodes() {
        assertEquals("R5", new Tile(TileColor.RED, 5).shortName());
        assertEquals("K13", new Tile(TileColor.BLACK, 13).toString());
        assertEquals("O1", new Tile(TileColor.ORANGE, 1).typeKey());
    }
}
