package ai.rummikub.unit.player;

import static ai.rummikub.unit.helpers.TileFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import ai.rummikub.game.Board;
import ai.rummikub.game.Meld;
import ai.rummikub.game.Tile;
import ai.rummikub.player.HumanPlayer;
import ai.rummikub.player.TurnContext;
import ai.rummikub.player.ai.GreedyPlayer;
import ai.rummikub.turn.GameState;
import ai.rummikub.turn.TurnEngine;
import ai.rummikub.turn.TurnOutcome;
import ai.rummikub.turn.TurnProposal;
import ai.rummikub.unit.helpers.ScriptedPlayer;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

/**
 * The human bridge: turns wait for input, and each action resolves the pending turn once.
 */
class HumanPlayerTest {

    @Test
    void turnWaitsUntilTheHumanDraws() {
        HumanPlayer human = new HumanPlayer("Alice");
        GameState state = twoPlayerState(new Board(), tiles(r(1)), tiles(b(1)), pileOf(5));
        TurnEngine engine = new TurnEngine(state, List.of(human, new ScriptedPlayer()), rules());

        CompletableFuture<TurnOutcome> outcome = engine.playNextTurn();

        assertFalse(outcome.isDone());
        assertTrue(human.isWaiting());
        assertEquals("alice", human.getCurrentContext().orElseThrow().getPlayerId());

        assertTrue(human.performDraw());

        assertEquals(TurnOutcome.Kind.DREW, outcome.join().getKind());
        assertFalse(human.isWaiting());
        assertFalse(human.performDraw(), "second action has no turn to resolve");
    }

    @Test
    void performPlayCommitsTheBoard() {
        Tile b10 = b(10);
        Tile k10 = k(10);
        Tile o10 = o(10);
        HumanPlayer human = new HumanPlayer("Alice");
        GameState state = twoPlayerState(new Board(), tiles(b10, k10, o10, r(2)), tiles(b(1)), pileOf(5));
        TurnEngine engine = new TurnEngine(state, List.of(human, new ScriptedPlayer()), rules());

        CompletableFuture<TurnOutcome> outcome = engine.playNextTurn();
        human.performPlay(board(Meld.of(b10, k10, o10)), List.of(b10, k10, o10));

        assertEquals(TurnOutcome.Kind.COMMITTED, outcome.join().getKind());
        assertEquals(1, state.getHandSize("alice"));
    }

    @Test
    void autoPlayUsesTheGreedyHelper() {
        HumanPlayer human = new HumanPlayer("Alice");
        GameState state = twoPlayerState(new Board(), tiles(b(10), k(10), o(10), r(2)), tiles(b(1)), pileOf(5));
        TurnEngine engine = new TurnEngine(state, List.of(human, new ScriptedPlayer()), rules());

        CompletableFuture<TurnOutcome> outcome = engine.playNextTurn();
        assertTrue(human.autoPlay());

        assertEquals(TurnOutcome.Kind.COMMITTED, outcome.join().getKind());
        assertEquals(1, state.getBoard().size());
        assertTrue(state.isOpeningMeldCompleted("alice"));
    }

    @Test
    void abandoningLeavesTheTurnWithTheHuman() {
        HumanPlayer human = new HumanPlayer("Alice");
        GameState state = twoPlayerState(new Board(), tiles(r(1)), tiles(b(1)), pileOf(5));
        TurnEngine engine = new TurnEngine(state, List.of(human, new ScriptedPlayer()), rules());

        CompletableFuture<TurnOutcome> outcome = engine.playNextTurn();
        assertTrue(human.abandonTurn());

        assertEquals(TurnOutcome.Kind.ABANDONED, outcome.join().getKind());
        assertEquals("alice", state.getCurrentPlayerId());

        CompletableFuture<TurnOutcome> retry = engine.playNextTurn();
        assertTrue(human.isWaiting());
        human.performDraw();
        assertEquals(TurnOutcome.Kind.DREW, retry.join().getKind());
    }

    @Test
    void autoPlayForAnEndedTurnDoesNotResolveTheNextOne() {
        AtomicReference<HumanPlayer> humanRef = new AtomicReference<>();
        AtomicReference<TurnEngine> engineRef = new AtomicReference<>();
        AtomicReference<CompletableFuture<TurnOutcome>> retry = new AtomicReference<>();
        GreedyPlayer slowHelper = new GreedyPlayer() {
            @Override
            public TurnProposal decide(TurnContext context) {
                // The turn is abandoned and asked again while the hint is being worked out.
                humanRef.get().abandonTurn();
                retry.set(engineRef.get().playNextTurn());
                return super.decide(context);
            }
        };
        HumanPlayer human = new HumanPlayer("Alice", slowHelper);
        humanRef.set(human);
        GameState state = twoPlayerState(new Board(), tiles(b(10), k(10), o(10), r(2)), tiles(b(1)), pileOf(5));
        TurnEngine engine = new TurnEngine(state, List.of(human, new ScriptedPlayer()), rules());
        engineRef.set(engine);

        CompletableFuture<TurnOutcome> first = engine.playNextTurn();

        assertFalse(human.autoPlay());
        assertEquals(TurnOutcome.Kind.ABANDONED, first.join().getKind());
        assertFalse(retry.get().isDone());
        assertTrue(human.isWaiting());
        assertTrue(state.getBoard().isEmpty());

        assertTrue(human.performDraw());
        assertEquals(TurnOutcome.Kind.DREW, retry.get().join().getKind());
    }

    @Test
    void actionsOutsideATurnAreIgnored() {
        HumanPlayer human = new HumanPlayer("Bob");
        assertFalse(human.isWaiting());
        assertFalse(human.performDraw());
        assertFalse(human.performPlay(new Board(), List.of()));
        assertFalse(human.autoPlay());
        assertFalse(human.abandonTurn());
        assertTrue(human.getCurrentContext().isEmpty());
    }
}
