package skirmish.game.skill;

import skirmish.game.Combatant;

/**
 * A plain hit that gives the caster one more turn.
 */
public class NormalAttack extends Skill {

    public NormalAttack(String name, int cost, int damage) {
        super(name, cost, damage);
    }

    public static NormalAttack mage() {
        return new NormalAttack("MageAttack", 5, 20);
    }

    public static NormalAttack rogue() {
        return new NormalAttack("RogueAttack", 3, 15);
    }

    @Override
    public void use(Combatant caster, Combatant target) {
        dealDamage(caster, target);
        caster.getBattleQueue().add(caster);
    }
}
