package skirmish.game.skill;

import com.google.common.collect.ImmutableList;
import skirmish.game.Combatant;

/**
 * The stock decision tree Sorcerers attack with, and the conditions it uses.
 */
public final class SkillDecisionTrees {

    private SkillDecisionTrees() {
    }

    /**
     * <pre>
     * 5 MageAttack      caster HP > 50
     *   3 MageAttack    caster SP > 20
     *     4 RogueSpecial  target HP < 30
     *       6 RogueAttack   never
     *   2 MageSpecial   target SP > 40
     *     8 RogueAttack   never
     *   1 RogueAttack   caster HP > 90
     *     7 RogueSpecial  never
     * </pre>
     */
    public static SkillDecisionTree createDefaultTree() {
        SkillDecisionTree sdt6 = new SkillDecisionTree(NormalAttack.rogue(), SkillDecisionTrees::never, 6);
        SkillDecisionTree sdt4 = new SkillDecisionTree(new RogueSpecial(), SkillDecisionTrees::targetHpBelow30, 4,
                ImmutableList.of(sdt6));
        SkillDecisionTree sdt3 = new SkillDecisionTree(NormalAttack.mage(), SkillDecisionTrees::casterSpAbove20, 3,
                ImmutableList.of(sdt4));

        SkillDecisionTree sdt8 = new SkillDecisionTree(NormalAttack.rogue(), SkillDecisionTrees::never, 8);
        SkillDecisionTree sdt2 = new SkillDecisionTree(new MageSpecial(), SkillDecisionTrees::targetSpAbove40, 2,
                ImmutableList.of(sdt8));

        SkillDecisionTree sdt7 = new SkillDecisionTree(new RogueSpecial(), SkillDecisionTrees::never, 7);
        SkillDecisionTree sdt1 = new SkillDecisionTree(NormalAttack.rogue(), SkillDecisionTrees::casterHpAbove90, 1,
                ImmutableList.of(sdt7));

        return new SkillDecisionTree(NormalAttack.mage(), SkillDecisionTrees::casterHpAbove50, 5,
                ImmutableList.of(sdt3, sdt2, sdt1));
    }

    public static boolean never(Combatant caster, Combatant target) {
        return false;
    }

    public static boolean targetHpBelow30(Combatant caster, Combatant target) {
        return target.getHp() < 30;
    }

    public static boolean casterSpAbove20(Combatant caster, Combatant target) {
        return caster.getSp() > 20;
    }

    public static boolean targetSpAbove40(Combatant caster, Combatant target) {
        return target.getSp() > 40;
    }

    public static boolean casterHpAbove90(Combatant caster, Combatant target) {
        return caster.getHp() > 90;
    }

    public static boolean casterHpAbove50(Combatant caster, Combatant target) {
        return caster.getHp() > 50;
    }
}
