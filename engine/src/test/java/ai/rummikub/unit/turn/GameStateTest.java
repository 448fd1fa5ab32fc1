package ai.rummikub.unit.turn;

import static ai.rummikub.unit.helpers.TileFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import ai.rummikub.game.Board;
import ai.rummikub.game.Meld;
import ai.rummikub.game.Tile;
import ai.rummikub.game.TileDeck;
import ai.rummikub.turn.GameSnapshot;
import ai.rummikub.turn.GameState;
import ai.rummikub.turn.TurnEngine;
import ai.rummikub.turn.TurnOutcome;
import ai.rummikub.unit.helpers.ScriptedPlayer;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

class GameStateTest {

    @Test
    void dealGivesEveryoneAHandAndKeepsTheRest() {
        GameState state = GameState.deal(List.of("a", "b", "c"), new TileDeck(new Random(3)), 14);

        assertEquals(14, state.getHandSize("a"));
        assertEquals(14, state.getHandSize("c"));
        assertEquals(TileDeck.STANDARD_SIZE - 42, state.getDrawPileSize());
        assertEquals(TileDeck.STANDARD_SIZE, state.totalTiles());
        assertEquals("a", state.getCurrentPlayerId());
        assertTrue(state.getBoard().isEmpty());
        assertFalse(state.isOpeningMeldCompleted("b"));
        assertFalse(state.isTerminal());
        assertTrue(state.getWinnerId().isEmpty());
    }

    @Test
    void readersCannotChangeTheState() {
        GameState state = twoPlayerState(board(Meld.of(r(1), r(2), r(3))), tiles(b(1)), tiles(k(1)), pileOf(2));

        state.getBoard().addMeld(Meld.of(o(1), o(2), o(3)));

        assertEquals(1, state.getBoard().size());
        assertThrows(UnsupportedOperationException.class, () -> state.getHand("alice").clear());
    }

    @Test
    void handReadEarlierKeepsItsContentsAfterATurn() {
        GameState state = twoPlayerState(new Board(), tiles(b(1)), tiles(k(1)), pileOf(2));
        TurnEngine engine = new TurnEngine(state, List.of(new ScriptedPlayer(), new ScriptedPlayer()), rules());
        List<Tile> aliceBefore = state.getHand("alice");

        assertEquals(TurnOutcome.Kind.DREW, engine.playTurn().getKind());

        assertEquals(1, aliceBefore.size());
        assertEquals(2, state.getHandSize("alice"));
    }

    @Test
    void unknownAndDuplicatePlayersAreRejected() {
        GameState state = twoPlayerState(new Board(), tiles(), tiles(), pileOf(0));
        assertThrows(IllegalArgumentException.class, () -> state.getHand("carol"));
        assertThrows(IllegalArgumentException.class,
                () -> new GameState(List.of("x", "x"), new Board(), pileOf(0), Map.of("x", tiles())));
        assertThrows(IllegalArgumentException.class,
                () -> new GameState(List.of("x", "y"), new Board(), pileOf(0), Map.of("x", tiles())));
    }

    @Test
    void snapshotIsDetachedFromTheGame() {
        GameState state = twoPlayerState(new Board(), tiles(b(1)), tiles(k(1), k(2)), pileOf(4));

        GameSnapshot snapshot = state.snapshot();

        assertEquals(List.of("alice", "bob"), List.copyOf(snapshot.hands().keySet()));
        assertEquals(2, snapshot.hands().get("bob").size());
        assertEquals(4, snapshot.drawPile().size());
        assertEquals(0, snapshot.currentPlayerIndex());
        assertFalse(snapshot.terminal());
        assertTrue(snapshot.winner().isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.hands().get("alice").clear());
        snapshot.board().addMeld(Meld.of(o(1), o(2), o(3)));
        assertTrue(snapshot.board().isEmpty());
    }
}
