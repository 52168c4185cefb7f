package skirmish.game;

import skirmish.game.skill.VampireAttack;
import skirmish.game.skill.VampireSpecial;

/**
 * Heals by what it drains, so its HP is not capped at the starting value.
 */
public class Vampire extends Combatant {
    public static final int DEFENSE = 12;

    public Vampire(String name, BattleQueue battleQueue, Playstyle playstyle) {
        super(name, battleQueue, playstyle, DEFENSE, new VampireAttack(), new VampireSpecial());
    }

    @Override
    protected Combatant newInstance(BattleQueue queue, Playstyle playstyle) {
        return new Vampire(getName(), queue, playstyle);
    }

    @Override
    public String getArchetype() {
        return "Vampire";
    }
}
