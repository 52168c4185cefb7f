package skirmish.ai.simulation;

import org.apache.commons.lang3.tuple.ImmutablePair;
import org.apache.commons.lang3.tuple.Pair;
import skirmish.game.Action;
import skirmish.game.BattleQueue;
import skirmish.game.Combatant;

/**
 * Plays single turns, either for real or on a copy of the queue for the search.
 */
public final class TurnSimulator {

    private TurnSimulator() {
    }

    /**
     * Has the combatant at the front of {@code queue} perform {@code action}, then
     * retires the ticket it acted on.
     *
     * Cleaning only drops tickets of combatants that cannot act any more, so a
     * combatant that still can act has its spent ticket removed here. One that
     * cannot is left for the next cleaning pass.
     *
     * @return the combatant that acted
     */
    public static Combatant resolve(BattleQueue queue, Action action) {
        Combatant actor = queue.peek();
        actor.perform(action);
        if (!actor.getAvailableActions().isEmpty()) {
            queue.remove();
        }
        return actor;
    }

    /**
     * Plays {@code action} on a copy of {@code queue}. The original is left alone.
     *
     * @param perspective a combatant of {@code queue} whose counterpart in the copy is wanted
     * @return the copied queue after the turn, and the copy of {@code perspective}
     */
    public static Pair<BattleQueue, Combatant> simulate(BattleQueue queue, Combatant perspective, Action action) {
        boolean perspectiveActs = perspective == queue.peek();
        BattleQueue copy = queue.copy();
        Combatant actor = copy.peek();
        Combatant mapped = perspectiveActs ? actor : actor.getEnemy();
        resolve(copy, action);
        return ImmutablePair.of(copy, mapped);
    }
}
