package skirmish.ai;

import skirmish.game.BattleQueue;
import skirmish.game.Playstyle;

import java.util.Locale;
import java.util.Random;

/**
 * The computer playstyles that can be picked by name.
 */
public enum PlaystyleKind {
    RANDOM,
    RECURSIVE,
    ITERATIVE;

    public Playstyle create(BattleQueue queue, AiProfile profile, Random random) {
        switch (this) {
            case RANDOM:
                return new RandomPlaystyle(queue, random);
            case RECURSIVE:
                return new MinimaxRecursivePlaystyle(queue, profile);
            case ITERATIVE:
                return new MinimaxIterativePlaystyle(queue);
            default:
                throw new IllegalStateException("Unhandled playstyle " + this);
        }
    }

    /**
     * Case-insensitive lookup.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static PlaystyleKind fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
