package skirmish.game.skill;

import skirmish.game.Combatant;

/**
 * Drains the target: the caster heals by exactly the HP the target lost.
 */
public class VampireAttack extends Skill {

    public VampireAttack() {
        super("VampireAttack", 15, 20);
    }

    protected VampireAttack(String name, int cost, int damage) {
        super(name, cost, damage);
    }

    @Override
    public void use(Combatant caster, Combatant target) {
        drain(caster, target);
        caster.getBattleQueue().add(caster);
    }

    protected void drain(Combatant caster, Combatant target) {
        int before = target.getHp();
        dealDamage(caster, target);
        caster.setHp(caster.getHp() + before - target.getHp());
    }
}
