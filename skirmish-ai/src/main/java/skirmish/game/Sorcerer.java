package skirmish.game;

import skirmish.game.skill.SkillDecisionTree;
import skirmish.game.skill.SorcererAttack;
import skirmish.game.skill.SorcererSpecial;

/**
 * Attacks with whatever skill its decision tree picks. Without a tree the attack
 * does nothing.
 */
public class Sorcerer extends Combatant {
    public static final int DEFENSE = 10;

    public Sorcerer(String name, BattleQueue battleQueue, Playstyle playstyle) {
        super(name, battleQueue, playstyle, DEFENSE, new SorcererAttack(), new SorcererSpecial());
    }

    public void setSkillDecisionTree(SkillDecisionTree tree) {
        ((SorcererAttack) getAttackSkill()).setDecisionTree(tree);
    }

    public SkillDecisionTree getSkillDecisionTree() {
        return ((SorcererAttack) getAttackSkill()).getDecisionTree();
    }

    @Override
    protected Combatant newInstance(BattleQueue queue, Playstyle playstyle) {
        Sorcerer copy = new Sorcerer(getName(), queue, playstyle);
        // trees are immutable, so copies share them
        copy.setSkillDecisionTree(getSkillDecisionTree());
        return copy;
    }

    @Override
    public String getArchetype() {
        return "Sorcerer";
    }
}
