package skirmish.game;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@link BattleQueue} where every ticket also records whether it may add new
 * tickets. The combatant at the front is assumed to be the one adding.
 *
 * <ul>
 * <li>A combatant with no ticket in the queue is always accepted, and that ticket can add.</li>
 * <li>While the front ticket cannot add, additions are silently ignored.</li>
 * <li>A ticket added for someone other than the front combatant cannot add.</li>
 * <li>A combatant that already holds two tickets able to add gets a ticket that cannot.</li>
 * </ul>
 *
 * <pre>
 * order:   A -> A -> B          A adds A:   A -> A -> B -> A
 * can add: Y    Y    Y                      Y    Y    Y    N
 * </pre>
 */
public class RestrictedBattleQueue extends BattleQueue {
    private static final int MAX_ADDING_TICKETS = 2;

    private final List<Boolean> permissions = new ArrayList<>();

    @Override
    public void add(Combatant combatant) {
        registerPlayers(combatant);

        if (!tickets.contains(combatant)) {
            append(combatant, true);
            return;
        }

        if (!permissions.get(0)) {
            return;
        }

        if (tickets.get(0) == combatant) {
            append(combatant, getAddAbilityCount(combatant) < MAX_ADDING_TICKETS);
        } else {
            append(combatant, false);
        }
    }

    private void append(Combatant combatant, boolean canAdd) {
        tickets.add(combatant);
        permissions.add(canAdd);
    }

    /**
     * Returns how many of the combatant's tickets are currently able to add.
     */
    public int getAddAbilityCount(Combatant combatant) {
        checkAligned();
        int count = 0;
        for (int i = 0; i < tickets.size(); i++) {
            if (tickets.get(i) == combatant && permissions.get(i)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Whether the ticket at {@code index} (raw position, no cleaning) may add tickets.
     */
    public boolean canAdd(int index) {
        checkAligned();
        return permissions.get(index);
    }

    @Override
    protected void cleanQueue() {
        super.cleanQueue();
        checkAligned(permissions.size() >= tickets.size());
        permissions.subList(0, permissions.size() - tickets.size()).clear();
    }

    @Override
    public Combatant remove() {
        Combatant front = super.remove();
        permissions.remove(0);
        return front;
    }

    @Override
    public RestrictedBattleQueue copy() {
        RestrictedBattleQueue copy = new RestrictedBattleQueue();
        fillCopy(copy);
        return copy;
    }

    private void checkAligned() {
        checkAligned(permissions.size() == tickets.size());
    }

    private void checkAligned(boolean aligned) {
        if (!aligned) {
            throw new InvariantViolationException("Permission table out of step with tickets: "
                    + permissions.size() + " permissions for " + tickets.size() + " tickets");
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < tickets.size(); i++) {
            if (i > 0) {
                sb.append(" -> ");
            }
            sb.append(tickets.get(i)).append(permissions.get(i) ? " [Y]" : " [N]");
        }
        return sb.toString();
    }
}
