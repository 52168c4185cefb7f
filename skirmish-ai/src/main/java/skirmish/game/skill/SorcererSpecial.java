package skirmish.game.skill;

import skirmish.game.BattleQueue;
import skirmish.game.Combatant;

import java.util.ArrayList;
import java.util.List;

/**
 * Collapses the queue to one ticket per combatant, in order of first appearance,
 * then queues the caster once more and hits the target.
 */
public class SorcererSpecial extends Skill {

    public SorcererSpecial() {
        super("SorcererSpecial", 20, 25);
    }

    @Override
    public void use(Combatant caster, Combatant target) {
        BattleQueue queue = caster.getBattleQueue();
        List<Combatant> order = new ArrayList<>(2);
        while (!queue.isEmpty()) {
            Combatant c = queue.remove();
            if (!order.contains(c)) {
                order.add(c);
            }
        }
        for (Combatant c : order) {
            queue.add(c);
        }
        queue.add(caster);
        dealDamage(caster, target);
    }
}
