package skirmish.game;

import skirmish.game.skill.NormalAttack;
import skirmish.game.skill.RogueSpecial;

public class Rogue extends Combatant {
    public static final int DEFENSE = 10;

    public Rogue(String name, BattleQueue battleQueue, Playstyle playstyle) {
        super(name, battleQueue, playstyle, DEFENSE, NormalAttack.rogue(), new RogueSpecial());
    }

    @Override
    protected Combatant newInstance(BattleQueue queue, Playstyle playstyle) {
        return new Rogue(getName(), queue, playstyle);
    }

    @Override
    public String getArchetype() {
        return "Rogue";
    }
}
