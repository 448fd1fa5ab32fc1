package ai.rummikub.player.ai;

import ai.rummikub.player.AIPlayer;
import ai.rummikub.player.TurnContext;
import ai.rummikub.solver.Solver;
import ai.rummikub.turn.TurnProposal;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Greedy player that holds tiles back.
 * <p>
 * It works out the greedy play every turn, but once it has opened and its hand is smaller than
 * the hoarding threshold it draws instead, unless the play would empty the hand and win. The
 * opening meld is always played as soon as it is available.
 */
public class HoardingPlayer extends GreedyPlayer {
    private static final Logger log = LoggerFactory.getLogger(HoardingPlayer.class);

    public static final int DEFAULT_THRESHOLD = 20;

    private final int threshold;

    public HoardingPlayer() {
        this(DEFAULT_THRESHOLD, new Solver());
    }

    public HoardingPlayer(int threshold, Solver solver) {
        super(solver);
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold must be >= 0: " + threshold);
        }
        this.threshold = threshold;
    }

    public int getThreshold() {
        return threshold;
    }

    @Override
    public TurnProposal decide(TurnContext context) {
        Optional<AIPlayer.PlannedPlay> plan = planGreedy(context);
        if (plan.isEmpty()) {
            return TurnProposal.draw();
        }
        int handSize = context.getHand().size();
        boolean wins = plan.get().claimed().size() == handSize;
        if (wins || !context.isOpeningMeldCompleted() || handSize >= threshold) {
            return plan.get().toProposal();
        }
        if (log.isDebugEnabled()) {
            log.debug("{} hoards: hand of {} is below {}", context.getPlayerId(), handSize, threshold);
        }
        return TurnProposal.draw();
    }
}
