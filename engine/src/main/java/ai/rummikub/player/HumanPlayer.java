package ai.rummikub.player;

import ai.rummikub.game.Board;
import ai.rummikub.game.Tile;
import ai.rummikub.player.ai.GreedyPlayer;
import ai.rummikub.turn.TurnProposal;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Human player bridged to an external input source (a UI, a console, a test).
 * <p>
 * {@link #proposeTurn(TurnContext)} hands the engine a future that stays pending until the
 * human acts through {@link #performDraw()}, {@link #performPlay(Board, List)} or
 * {@link #autoPlay()}. {@link #abandonTurn()} cancels it, which the engine treats as an
 * abandoned turn. Actions arriving while no turn is pending are ignored with a warning.
 */
public class HumanPlayer implements Player {
    private static final Logger log = LoggerFactory.getLogger(HumanPlayer.class);

    private final String name;
    private final GreedyPlayer helper;
    private final Object lock = new Object();

    private CompletableFuture<TurnProposal> pending;
    private TurnContext context;

    public HumanPlayer(String name) {
        this(name, new GreedyPlayer());
    }

    /**
     * @param name   display name used in log lines
     * @param helper the strategy {@link #autoPlay()} delegates to
     */
    public HumanPlayer(String name, GreedyPlayer helper) {
        this.name = name;
        this.helper = helper;
    }

    @Override
    public CompletableFuture<TurnProposal> proposeTurn(TurnContext context) {
        CompletableFuture<TurnProposal> future = new CompletableFuture<>();
        synchronized (lock) {
            this.pending = future;
            this.context = context;
        }
        log.info("It is {}'s turn. Waiting for input...", name);
        return future;
    }

    /**
     * {@code true} while a turn is waiting for this player's action.
     */
    public boolean isWaiting() {
        synchronized (lock) {
            return pending != null;
        }
    }

    /**
     * The view of the turn currently waiting for input, if any.
     */
    public Optional<TurnContext> getCurrentContext() {
        synchronized (lock) {
            return Optional.ofNullable(context);
        }
    }

    /**
     * Draws a tile.
     *
     * @return {@code false} if no turn was waiting
     */
    public boolean performDraw() {
        return resolve(TurnProposal.draw(), "performDraw");
    }

    /**
     * Proposes a whole new board together with the hand tiles it uses.
     *
     * @return {@code false} if no turn was waiting
     */
    public boolean performPlay(Board newBoard, List<Tile> claimedTiles) {
        return resolve(TurnProposal.play(newBoard, claimedTiles), "performPlay");
    }

    /**
     * Lets the greedy strategy take this one turn.
     *
     * @return {@code false} if no turn was waiting
     */
    public boolean autoPlay() {
        CompletableFuture<TurnProposal> future;
        TurnContext current;
        synchronized (lock) {
            future = pending;
            current = context;
        }
        if (future == null) {
            log.warn("Attempted autoPlay for {} but it is not their turn", name);
            return false;
        }
        TurnProposal proposal = helper.decide(current);
        synchronized (lock) {
            if (pending != future) {
                log.warn("Discarding autoPlay for {}: the turn it was worked out for has ended", name);
                return false;
            }
            pending = null;
            context = null;
        }
        return future.complete(proposal);
    }

    /**
     * Gives up on the pending turn; the engine reports it as abandoned and asks again later.
     *
     * @return {@code false} if no turn was waiting
     */
    public boolean abandonTurn() {
        CompletableFuture<TurnProposal> future = take();
        if (future == null) {
            log.warn("Attempted abandonTurn for {} but it is not their turn", name);
            return false;
        }
        return future.cancel(false);
    }

    public String getName() {
        return name;
    }

    private boolean resolve(TurnProposal proposal, String action) {
        CompletableFuture<TurnProposal> future = take();
        if (future == null) {
            log.warn("Attempted {} for {} but it is not their turn", action, name);
            return false;
        }
        // Completed outside the lock: the engine resolves the turn on this thread.
        return future.complete(proposal);
    }

    private CompletableFuture<TurnProposal> take() {
        synchronized (lock) {
            CompletableFuture<TurnProposal> future = pending;
            pending = null;
            context = null;
            return future;
        }
    }

    @Override
    public String toString() {
        return "HumanPlayer(" + name + ")";
    }
}
