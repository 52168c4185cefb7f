package skirmish.ai;

import org.apache.commons.lang3.tuple.Pair;
import skirmish.ai.simulation.StateScorer;
import skirmish.ai.simulation.TurnSimulator;
import skirmish.game.Action;
import skirmish.game.BattleQueue;
import skirmish.game.Combatant;
import skirmish.game.Playstyle;

import java.util.List;

/**
 * Picks the move that guarantees the best final score, scoring positions with a
 * recursive {@link StateScorer}. Ties go to the first move in attack, special order.
 */
public class MinimaxRecursivePlaystyle extends Playstyle {
    private final AiProfile profile;
    private StateScorer lastScorer;

    public MinimaxRecursivePlaystyle(BattleQueue battleQueue) {
        this(battleQueue, AiProfile.defaults());
    }

    public MinimaxRecursivePlaystyle(BattleQueue battleQueue, AiProfile profile) {
        super(battleQueue);
        this.profile = profile;
    }

    @Override
    public Action selectAction() {
        if (battleQueue.isOver()) {
            return Action.NONE;
        }
        List<Action> actions = battleQueue.peek().getAvailableActions();
        if (actions.isEmpty()) {
            return Action.NONE;
        }

        StateScorer scorer = StateScorer.fromProfile(profile);
        lastScorer = scorer;
        int bestScore = scorer.scoreState(battleQueue);

        for (Action action : actions) {
            BattleQueue start = battleQueue.copy();
            Combatant actor = start.peek();
            Pair<BattleQueue, Combatant> next = TurnSimulator.simulate(start, actor, action);
            if (scorer.scoreFor(next.getRight(), next.getLeft()) == bestScore) {
                return action;
            }
        }
        return Action.NONE;
    }

    /**
     * The scorer used by the most recent decision, for statistics; null before the first one.
     */
    public StateScorer getLastScorer() {
        return lastScorer;
    }

    public AiProfile getProfile() {
        return profile;
    }

    @Override
    public Playstyle copy(BattleQueue queue) {
        return new MinimaxRecursivePlaystyle(queue, profile);
    }

    @Override
    public String getName() {
        return "recursive";
    }
}
