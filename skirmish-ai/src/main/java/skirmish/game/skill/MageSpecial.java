package skirmish.game.skill;

import skirmish.game.Combatant;

/**
 * Heavy hit after which the target moves first, then the caster.
 */
public class MageSpecial extends Skill {

    public MageSpecial() {
        super("MageSpecial", 30, 40);
    }

    @Override
    public void use(Combatant caster, Combatant target) {
        dealDamage(caster, target);
        caster.getBattleQueue().add(target);
        caster.getBattleQueue().add(caster);
    }
}
