package skirmish.game;

import skirmish.game.skill.SkillDecisionTrees;

import java.util.Locale;

/**
 * The kinds of combatant that can be picked by name.
 */
public enum Archetype {
    ROGUE,
    MAGE,
    VAMPIRE,
    SORCERER;

    /**
     * Creates a combatant of this archetype. Sorcerers get the default decision tree.
     */
    public Combatant create(String name, BattleQueue queue, Playstyle playstyle) {
        switch (this) {
            case ROGUE:
                return new Rogue(name, queue, playstyle);
            case MAGE:
                return new Mage(name, queue, playstyle);
            case VAMPIRE:
                return new Vampire(name, queue, playstyle);
            case SORCERER:
                Sorcerer sorcerer = new Sorcerer(name, queue, playstyle);
                sorcerer.setSkillDecisionTree(SkillDecisionTrees.createDefaultTree());
                return sorcerer;
            default:
                throw new IllegalStateException("Unhandled archetype " + this);
        }
    }

    /**
     * Case-insensitive lookup.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static Archetype fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
