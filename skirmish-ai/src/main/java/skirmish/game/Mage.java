package skirmish.game;

import skirmish.game.skill.MageSpecial;
import skirmish.game.skill.NormalAttack;

public class Mage extends Combatant {
    public static final int DEFENSE = 8;

    public Mage(String name, BattleQueue battleQueue, Playstyle playstyle) {
        super(name, battleQueue, playstyle, DEFENSE, NormalAttack.mage(), new MageSpecial());
    }

    @Override
    protected Combatant newInstance(BattleQueue queue, Playstyle playstyle) {
        return new Mage(getName(), queue, playstyle);
    }

    @Override
    public String getArchetype() {
        return "Mage";
    }
}
