package ai.rummikub.player.ai;

import ai.rummikub.player.AIPlayer;
import ai.rummikub.player.TurnContext;
import ai.rummikub.solver.Solver;
import ai.rummikub.turn.TurnProposal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Greedy (1-ply) player: plays as many tiles as it can find a legal board for, right now.
 *
 * - Phase A: lays down the groups and runs the hand forms by itself.
 * - Phase B: tries each remaining hand tile against the pool and keeps every tile the solver can
 *   still fit in, rearranging board melds once the opening meld is done.
 * - Draws when nothing fits or, before the opening meld, when the play is worth less than the
 *   opening threshold.
 *
 * It never compares alternatives; the only question is how much can go down this turn.
 */
public class GreedyPlayer extends AIPlayer {
    private static final Logger log = LoggerFactory.getLogger(GreedyPlayer.class);

    public GreedyPlayer() {
        this(new Solver());
    }

    public GreedyPlayer(Solver solver) {
        super(solver);
    }

    @Override
    public TurnProposal decide(TurnContext context) {
        return planGreedy(context)
                .map(plan -> {
                    if (log.isDebugEnabled()) {
                        log.debug("{} plays {} tile(s): {}", context.getPlayerId(),
                                plan.claimed().size(), plan.claimed());
                    }
                    return plan.toProposal();
                })
                .orElseGet(TurnProposal::draw);
    }
}
