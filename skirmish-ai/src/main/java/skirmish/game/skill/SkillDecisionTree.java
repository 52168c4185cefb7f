package skirmish.game.skill;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import skirmish.game.Combatant;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BiPredicate;

/**
 * Picks the skill a caster uses against a target.
 *
 * Every node holds a skill, a condition on (caster, target) and a priority.
 * A passing condition sends the search down into the node's children; a failing
 * condition, or a leaf, makes the node itself a candidate. Of all candidates the
 * one with the smallest priority number wins.
 *
 * Trees are immutable and can be shared between combatants and their copies.
 */
public class SkillDecisionTree {
    private final Skill skill;
    private final BiPredicate<Combatant, Combatant> condition;
    private final int priority;
    private final ImmutableList<SkillDecisionTree> children;

    public SkillDecisionTree(Skill skill, BiPredicate<Combatant, Combatant> condition, int priority) {
        this(skill, condition, priority, ImmutableList.of());
    }

    /**
     * @throws IllegalArgumentException if a priority appears more than once in the tree
     */
    public SkillDecisionTree(Skill skill, BiPredicate<Combatant, Combatant> condition, int priority,
                             List<SkillDecisionTree> children) {
        this.skill = Preconditions.checkNotNull(skill, "skill");
        this.condition = Preconditions.checkNotNull(condition, "condition");
        this.priority = priority;
        this.children = ImmutableList.copyOf(children);

        List<Integer> all = getPriorities();
        Set<Integer> unique = new HashSet<>(all);
        Preconditions.checkArgument(unique.size() == all.size(),
                "Priorities must be unique within a decision tree, got %s", all);
    }

    /**
     * Returns the skill of the candidate with the smallest priority number, or
     * null when there is no candidate.
     */
    public Skill pickSkill(Combatant caster, Combatant target) {
        List<SkillDecisionTree> candidates = getCandidates(caster, target);
        if (candidates.isEmpty()) {
            return null;
        }
        SkillDecisionTree best = candidates.get(0);
        for (SkillDecisionTree candidate : candidates) {
            if (candidate.priority < best.priority) {
                best = candidate;
            }
        }
        return best.skill;
    }

    /**
     * Returns the nodes this tree offers for the given pair, left to right.
     */
    public List<SkillDecisionTree> getCandidates(Combatant caster, Combatant target) {
        if (isLeaf() || !condition.test(caster, target)) {
            return ImmutableList.of(this);
        }
        List<SkillDecisionTree> candidates = new ArrayList<>();
        for (SkillDecisionTree child : children) {
            candidates.addAll(child.getCandidates(caster, target));
        }
        return candidates;
    }

    /**
     * Priorities of every node, in pre-order.
     */
    public List<Integer> getPriorities() {
        List<Integer> result = new ArrayList<>();
        result.add(priority);
        for (SkillDecisionTree child : children) {
            result.addAll(child.getPriorities());
        }
        return result;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public Skill getSkill() {
        return skill;
    }

    public int getPriority() {
        return priority;
    }

    public List<SkillDecisionTree> getChildren() {
        return children;
    }

    @Override
    public String toString() {
        return priority + ":" + skill.getName();
    }
}
