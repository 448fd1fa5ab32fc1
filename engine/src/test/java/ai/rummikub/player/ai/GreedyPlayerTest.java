package ai.rummikub.player.ai;

import static ai.rummikub.unit.helpers.TileFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import ai.rummikub.game.Board;
import ai.rummikub.game.Meld;
import ai.rummikub.game.Tile;
import ai.rummikub.player.TurnContext;
import ai.rummikub.turn.GameState;
import ai.rummikub.turn.TurnEngine;
import ai.rummikub.turn.TurnOutcome;
import ai.rummikub.turn.TurnProposal;
import ai.rummikub.unit.helpers.ScriptedPlayer;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Greedy strategy: what it lays down, when it holds back, and that the engine accepts its plays.
 */
class GreedyPlayerTest {
    private static final Logger log = LoggerFactory.getLogger(GreedyPlayerTest.class);

    private final GreedyPlayer greedy = new GreedyPlayer();

    @Test
    void opensWithAGroupAndKeepsTheBoard() {
        Tile r10 = r(10);
        Tile b10 = b(10);
        Tile k10 = k(10);
        Meld existing = Meld.of(o(4), o(5), o(6));

        TurnProposal proposal = greedy.decide(context(board(existing), tiles(r10, b10, k10, r(1), o(8)), false));

        assertFalse(proposal.isDraw());
        assertEquals(Set.of(r10, b10, k10), new HashSet<>(proposal.getClaimedTiles()));
        assertEquals(existing, proposal.getNewBoard().getMelds().get(0));
        assertEquals(2, proposal.getNewBoard().size());
        assertTrue(proposal.getNewBoard().isValid());
    }

    @Test
    void holdsBackBelowTheOpeningThreshold() {
        TurnProposal proposal = greedy.decide(context(new Board(), tiles(r(1), r(2), r(3), k(9)), false));
        assertTrue(proposal.isDraw());
    }

    @Test
    void extendsBoardMeldsOnceOpened() {
        Tile r8 = r(8);
        Tile wildcard = w();
        Board current = board(Meld.of(r(5), r(6), r(7)));

        TurnProposal proposal = greedy.decide(context(current, tiles(r8, b(2), wildcard), true));

        assertEquals(Set.of(r8, wildcard), new HashSet<>(proposal.getClaimedTiles()));
        assertEquals(5, proposal.getNewBoard().tileCount());
        assertTrue(proposal.getNewBoard().isValid());
    }

    @Test
    void drawsWhenNothingFits() {
        TurnProposal proposal = greedy.decide(context(board(Meld.of(r(5), r(6), r(7))), tiles(b(1), k(9)), true));
        assertTrue(proposal.isDraw());
    }

    @Test
    void engineAcceptsGreedyPlays() {
        Tile r10 = r(10);
        Tile b10 = b(10);
        Tile k10 = k(10);
        Tile r11 = r(11);
        GameState state = twoPlayerState(board(Meld.of(o(1), o(2), o(3))), tiles(r10, b10, k10, r11, o(4)),
                tiles(b(1)), pileOf(10));
        TurnEngine engine = new TurnEngine(state, List.of(greedy, new ScriptedPlayer()), rules());

        TurnOutcome outcome = engine.playTurn();
        if (log.isDebugEnabled()) {
            log.debug("Board after greedy opening:\n{}", state.getBoard());
        }

        assertEquals(TurnOutcome.Kind.COMMITTED, outcome.getKind());
        assertTrue(state.getBoard().isValid());
        assertEquals(2, state.getHandSize("alice"));
        assertEquals(19, state.totalTiles());
    }

    static TurnContext context(Board board, List<Tile> hand, boolean opened) {
        return new TurnContext("me", board, hand, opened, 30, Map.of("other", 14), 50);
    }
}
