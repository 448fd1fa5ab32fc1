package ai.rummikub.player.ai;

import static ai.rummikub.player.ai.GreedyPlayerTest.context;
import static ai.rummikub.unit.helpers.TileFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import ai.rummikub.game.Board;
import ai.rummikub.game.Meld;
import ai.rummikub.game.Tile;
import ai.rummikub.solver.Solver;
import ai.rummikub.turn.GameState;
import ai.rummikub.turn.TurnEngine;
import ai.rummikub.turn.TurnOutcome;
import ai.rummikub.turn.TurnProposal;
import ai.rummikub.unit.helpers.ScriptedPlayer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

/**
 * Candidate generation and scoring of the one-ply lookahead.
 */
class LookaheadPlayerTest {

    private final LookaheadPlayer lookahead = new LookaheadPlayer(1_000L, true, new Solver());

    @Test
    void prefersPlayingTheMostTiles() {
        List<Tile> hand = tiles(r(10), b(10), k(10), o(1), o(2), o(3), k(13));

        TurnProposal proposal = lookahead.decide(context(new Board(), hand, false));

        assertFalse(proposal.isDraw());
        assertEquals(6, proposal.getClaimedTiles().size());
        assertTrue(proposal.getNewBoard().isValid());
    }

    @Test
    void skipsCombinationsBelowTheOpeningThreshold() {
        TurnProposal proposal = lookahead.decide(context(new Board(), tiles(o(1), o(2), o(3), k(13)), false));
        assertTrue(proposal.isDraw());
    }

    @Test
    void faceValueModeStillPlays() {
        LookaheadPlayer byValue = new LookaheadPlayer(1_000L, false, new Solver());
        Board current = board(Meld.of(r(5), r(6), r(7)));

        TurnProposal proposal = byValue.decide(context(current, tiles(r(8), b(2)), true));

        assertEquals(1, proposal.getClaimedTiles().size());
        assertEquals(4, proposal.getNewBoard().tileCount());
    }

    @Test
    void engineAcceptsLookaheadPlays() {
        GameState state = twoPlayerState(board(Meld.of(b(1), b(2), b(3))),
                tiles(r(10), b(10), k(10), o(11), o(12), o(13)), tiles(k(1)), pileOf(10));
        TurnEngine engine = new TurnEngine(state, List.of(lookahead, new ScriptedPlayer()), rules());

        TurnOutcome outcome = engine.playTurn();

        assertEquals(TurnOutcome.Kind.COMMITTED, outcome.getKind());
        assertTrue(outcome.isGameOver());
        assertEquals(3, state.getBoard().size());
    }

    @Test
    void greedyPlanIsSkippedOnceTheTimeLimitHasPassed() {
        AtomicInteger clockReads = new AtomicInteger();
        LookaheadPlayer outOfTime = new LookaheadPlayer(1L, true, new Solver(),
                () -> clockReads.getAndIncrement() == 0 ? 0L : Long.MAX_VALUE / 2);
        Board current = board(Meld.of(r(5), r(6), r(7)));

        TurnProposal proposal = outOfTime.decide(context(current, tiles(r(8), b(2)), true));

        assertTrue(proposal.isDraw(), "only the greedy plan could place R8");
        assertFalse(lookahead.decide(context(current, tiles(r(8), b(2)), true)).isDraw());
    }

    @Test
    void combinationsAreCappedAtFiveSets() {
        List<List<Tile>> sets = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            sets.add(List.of(r(1 + i)));
        }
        assertEquals(31, LookaheadPlayer.combinations(sets).size());
        assertEquals(7, LookaheadPlayer.combinations(sets.subList(0, 3)).size());
        assertTrue(LookaheadPlayer.combinations(List.of()).isEmpty());
    }

    @Test
    void wildcardsScoreThirty() {
        assertEquals(35, LookaheadPlayer.faceScore(tiles(w(), r(5))));
    }
}
