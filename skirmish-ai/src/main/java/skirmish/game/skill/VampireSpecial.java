package skirmish.game.skill;

import skirmish.game.Combatant;

/**
 * Stronger drain; the caster gets two turns before the target's next one.
 */
public class VampireSpecial extends VampireAttack {

    public VampireSpecial() {
        super("VampireSpecial", 20, 30);
    }

    @Override
    public void use(Combatant caster, Combatant target) {
        drain(caster, target);
        caster.getBattleQueue().add(caster);
        caster.getBattleQueue().add(caster);
        caster.getBattleQueue().add(target);
    }
}
