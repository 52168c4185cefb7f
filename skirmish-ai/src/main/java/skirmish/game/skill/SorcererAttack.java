package skirmish.game.skill;

import skirmish.game.Combatant;

/**
 * Lets a decision tree pick which skill to cast. Whatever the chosen skill costs,
 * the caster ends up paying this skill's cost.
 */
public class SorcererAttack extends Skill {
    private SkillDecisionTree decisionTree;

    public SorcererAttack() {
        super("SorcererAttack", 15, 0);
    }

    public SkillDecisionTree getDecisionTree() {
        return decisionTree;
    }

    public void setDecisionTree(SkillDecisionTree decisionTree) {
        this.decisionTree = decisionTree;
    }

    /**
     * Returns the skill the decision tree picks for this pair, or null without a tree.
     */
    public Skill chooseSkill(Combatant caster, Combatant target) {
        if (decisionTree == null) {
            return null;
        }
        return decisionTree.pickSkill(caster, target);
    }

    @Override
    public void use(Combatant caster, Combatant target) {
        Skill chosen = chooseSkill(caster, target);
        if (chosen == null) {
            return;
        }
        chosen.use(caster, target);
        caster.setSp(caster.getSp() + chosen.getSpCost() - getSpCost());
    }
}
