package skirmish.game.skill;

import skirmish.game.Combatant;

/**
 * Hit that gives the caster two more turns.
 */
public class RogueSpecial extends Skill {

    public RogueSpecial() {
        super("RogueSpecial", 10, 20);
    }

    @Override
    public void use(Combatant caster, Combatant target) {
        dealDamage(caster, target);
        caster.getBattleQueue().add(caster);
        caster.getBattleQueue().add(caster);
    }
}
