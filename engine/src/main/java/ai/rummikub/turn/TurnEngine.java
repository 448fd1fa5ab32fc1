package ai.rummikub.turn;

import ai.rummikub.config.RulesProperties;
import ai.rummikub.player.Player;
import ai.rummikub.player.TurnContext;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the turns of one game.
 * <p>
 * Each call to {@link #playNextTurn()} goes through the same phases:
 * <ol>
 *   <li>Build a {@link TurnContext} (board copy, hand copy, public information) for the player
 *       to move.</li>
 *   <li>Ask the player for a {@link TurnProposal}. This is the only place a turn may wait.</li>
 *   <li>Resolve it: a draw takes one tile; a play is checked by {@link PlayValidator} and
 *       either committed (board replaced, tiles leave the hand) or rejected (penalty draw,
 *       board untouched).</li>
 *   <li>Detect a win, otherwise pass the turn to the next seat.</li>
 * </ol>
 * Illegal proposals never escape as exceptions; they come back as {@link TurnOutcome}s. Only
 * misuse of the engine itself (a turn requested after game over or while a proposal is still
 * outstanding) throws {@link IllegalStateException}.
 * <p>
 * At most one proposal is outstanding at any time. If it completes exceptionally or is
 * cancelled, the turn is {@linkplain TurnOutcome.Kind#ABANDONED abandoned}: nothing changes and
 * the same player is asked again on the next call. The engine defines no timeout; callers
 * waiting on human input must impose one.
 */
public class TurnEngine {
    private static final Logger log = LoggerFactory.getLogger(TurnEngine.class);

    private final GameState state;
    private final List<Player> players;
    private final RulesProperties rules;
    private final Object lock = new Object();

    private TurnPhase phase;
    private boolean awaitingProposal;
    private int turnsResolved;

    /**
     * @param state   the game to run; the engine becomes its only writer
     * @param players one player per seat, in the order of {@link GameState#getPlayerIds()}
     * @param rules   the rules to enforce
     * @throws IllegalArgumentException if the number of players does not match the seats
     */
    public TurnEngine(GameState state, List<Player> players, RulesProperties rules) {
        this.state = Objects.requireNonNull(state, "state");
        this.players = List.copyOf(players);
        this.rules = Objects.requireNonNull(rules, "rules");
        if (this.players.size() != state.getPlayerCount()) {
            throw new IllegalArgumentException("Expected " + state.getPlayerCount()
                    + " players but got " + this.players.size());
        }
        this.phase = state.isTerminal() ? TurnPhase.GAME_OVER : TurnPhase.AWAITING_PROPOSAL;
    }

    /**
     * Plays the current player's turn.
     *
     * @return a future completed with the outcome once the player's proposal has been resolved
     * @throws IllegalStateException if the game is over or a proposal is still outstanding
     */
    public CompletableFuture<TurnOutcome> playNextTurn() {
        String playerId;
        Player player;
        TurnContext context;
        synchronized (lock) {
            if (phase == TurnPhase.GAME_OVER) {
                throw new IllegalStateException("The game is over; winner: "
                        + state.getWinnerId().orElse("none"));
            }
            if (awaitingProposal) {
                throw new IllegalStateException("Still waiting for a proposal from "
                        + state.getCurrentPlayerId());
            }

            playerId = state.getCurrentPlayerId();
            player = players.get(state.getCurrentPlayerIndex());
            context = buildContext(playerId);
            awaitingProposal = true;
        }

        // The player decides without the lock; awaitingProposal keeps other turns out meanwhile.
        CompletableFuture<TurnProposal> proposal;
        try {
            proposal = player.proposeTurn(context);
            if (proposal == null) {
                proposal = CompletableFuture.failedFuture(
                        new IllegalStateException(playerId + " returned no proposal future"));
            }
        } catch (RuntimeException e) {
            proposal = CompletableFuture.failedFuture(e);
        }
        return proposal.handle((p, error) -> resolve(playerId, p, error));
    }

    /**
     * Plays the current player's turn and waits for it. Only for players that answer without
     * external input; with a {@code HumanPlayer} this blocks until the human acts.
     *
     * @return the outcome of the turn
     */
    public TurnOutcome playTurn() {
        return playNextTurn().join();
    }

    public GameState getState() {
        return state;
    }

    public TurnPhase getPhase() {
        synchronized (lock) {
            return phase;
        }
    }

    /**
     * {@code true} while the current player's proposal has been requested but not received.
     */
    public boolean isAwaitingProposal() {
        synchronized (lock) {
            return awaitingProposal;
        }
    }

    public boolean isGameOver() {
        return getPhase() == TurnPhase.GAME_OVER;
    }

    /**
     * Number of turns resolved so far (abandoned turns are not counted).
     */
    public int getTurnsResolved() {
        synchronized (lock) {
            return turnsResolved;
        }
    }

    public RulesProperties getRules() {
        return rules;
    }

    private TurnContext buildContext(String playerId) {
        Map<String, Integer> opponents = new LinkedHashMap<>();
        for (String id : state.getPlayerIds()) {
            if (!id.equals(playerId)) {
                opponents.put(id, state.getHandSize(id));
            }
        }
        return new TurnContext(
                playerId,
                state.getBoard(),
                state.getHand(playerId),
                state.isOpeningMeldCompleted(playerId),
                rules.getOpeningThreshold(),
                opponents,
                state.getDrawPileSize());
    }

    private TurnOutcome resolve(String playerId, TurnProposal proposal, Throwable error) {
        synchronized (lock) {
            awaitingProposal = false;
            if (error != null) {
                if (log.isDebugEnabled()) {
                    log.debug("Proposal from {} was abandoned: {}", playerId, error.toString());
                }
                return TurnOutcome.abandoned(playerId);
            }

            phase = TurnPhase.EVALUATING;
            TurnOutcome outcome = evaluate(playerId, proposal);
            turnsResolved++;
            if (state.isTerminal()) {
                phase = TurnPhase.GAME_OVER;
                log.info("{} emptied their hand and wins after {} turns", playerId, turnsResolved);
            } else {
                state.advanceTurn();
                phase = TurnPhase.AWAITING_PROPOSAL;
            }
            if (log.isDebugEnabled()) {
                log.debug("Turn {}: {}", turnsResolved, outcome);
            }
            return outcome;
        }
    }

    private TurnOutcome evaluate(String playerId, TurnProposal proposal) {
        if (proposal != null && proposal.isDraw()) {
            int drawn = state.drawInto(playerId, 1);
            return TurnOutcome.drew(playerId, drawn);
        }

        Optional<RejectionReason> rejection = PlayValidator.check(
                state.board(),
                proposal,
                state.getHand(playerId),
                state.isOpeningMeldCompleted(playerId),
                rules);
        if (rejection.isPresent()) {
            int drawn = state.drawInto(playerId, rules.getPenaltyDraws());
            log.info("Rejected play from {}: {} Penalty: {} tile(s).",
                    playerId, rejection.get().getMessage(), drawn);
            return TurnOutcome.rejected(playerId, rejection.get(), drawn);
        }

        state.replaceBoard(proposal.getNewBoard());
        state.removeFromHand(playerId, proposal.getClaimedTiles());
        state.markOpeningMeldCompleted(playerId);
        boolean won = state.getHandSize(playerId) == 0;
        if (won) {
            state.declareWinner(playerId);
        }
        return TurnOutcome.committed(playerId, proposal.getClaimedTiles().size(), won);
    }
}
