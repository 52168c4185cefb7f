package skirmish.game;

/**
 * Decides the move of whichever combatant is at the front of a battle queue.
 */
public abstract class Playstyle {
    protected final BattleQueue battleQueue;

    protected Playstyle(BattleQueue battleQueue) {
        this.battleQueue = battleQueue;
    }

    public BattleQueue getBattleQueue() {
        return battleQueue;
    }

    /**
     * Returns the move for the next combatant in the queue, or {@link Action#NONE}
     * if there is no valid move.
     */
    public abstract Action selectAction();

    /**
     * Returns the same playstyle working on {@code queue}.
     */
    public abstract Playstyle copy(BattleQueue queue);

    /**
     * Short name used on the command line and in reports.
     */
    public abstract String getName();

    @Override
    public String toString() {
        return getName();
    }
}
