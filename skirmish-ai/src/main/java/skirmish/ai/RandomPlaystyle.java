package skirmish.ai;

import com.google.common.base.Preconditions;
import skirmish.game.Action;
import skirmish.game.BattleQueue;
import skirmish.game.Playstyle;

import java.util.List;
import java.util.Random;

/**
 * Picks uniformly among the moves the next combatant can afford.
 */
public class RandomPlaystyle extends Playstyle {
    private final Random random;

    public RandomPlaystyle(BattleQueue battleQueue) {
        this(battleQueue, new Random());
    }

    public RandomPlaystyle(BattleQueue battleQueue, Random random) {
        super(battleQueue);
        this.random = Preconditions.checkNotNull(random, "random");
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
        return actions.get(random.nextInt(actions.size()));
    }

    @Override
    public Playstyle copy(BattleQueue queue) {
        return new RandomPlaystyle(queue, random);
    }

    @Override
    public String getName() {
        return "random";
    }
}
