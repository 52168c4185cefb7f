package skirmish.view;

import com.google.common.base.Preconditions;
import org.apache.commons.lang3.StringUtils;
import skirmish.ai.AiProfile;
import skirmish.ai.PlaystyleKind;
import skirmish.cli.BattleOptions;
import skirmish.game.Archetype;
import skirmish.game.BattleQueue;
import skirmish.game.Combatant;
import skirmish.game.RestrictedBattleQueue;

import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Everything needed to start a battle: who fights, who decides their moves,
 * which queue they share and what they start with.
 */
public final class BattleSetup {
    public static final int PLAYERS = 2;

    private static final Archetype[] DEFAULT_ARCHETYPES = {Archetype.ROGUE, Archetype.MAGE};
    private static final PlaystyleKind[] DEFAULT_PLAYSTYLES = {PlaystyleKind.RECURSIVE, PlaystyleKind.RECURSIVE};

    private final Archetype[] archetypes = new Archetype[PLAYERS];
    private final String[] names = new String[PLAYERS];
    private final PlaystyleKind[] playstyles = new PlaystyleKind[PLAYERS];
    private final Integer[] startingHp = new Integer[PLAYERS];
    private final Integer[] startingSp = new Integer[PLAYERS];
    private final boolean restricted;
    private final AiProfile profile;

    private BattleSetup(boolean restricted, AiProfile profile) {
        this.restricted = restricted;
        this.profile = profile;
    }

    /**
     * Builds a setup from parsed command line options.
     *
     * @param playstyleNames playstyle per player; missing entries use the defaults
     * @throws IllegalArgumentException for unknown archetypes, playstyles or profiles,
     *                                  more than two players or negative stats
     */
    public static BattleSetup fromOptions(BattleOptions options, List<String> playstyleNames) {
        List<String> characters = options.getCharacters();
        Preconditions.checkArgument(characters.size() <= PLAYERS, "A battle has two combatants, got %s", characters.size());
        Preconditions.checkArgument(playstyleNames.size() <= PLAYERS, "A battle has two playstyles, got %s", playstyleNames.size());
        Preconditions.checkArgument(options.getNames().size() <= PLAYERS, "A battle has two names, got %s", options.getNames().size());

        BattleSetup setup = new BattleSetup(options.isRestricted(), loadProfile(options.getProfile()));
        for (int i = 0; i < PLAYERS; i++) {
            setup.archetypes[i] = i < characters.size() ? parseArchetype(characters.get(i)) : DEFAULT_ARCHETYPES[i];
            setup.playstyles[i] = i < playstyleNames.size() ? parsePlaystyle(playstyleNames.get(i)) : DEFAULT_PLAYSTYLES[i];
            setup.names[i] = i < options.getNames().size()
                    ? options.getNames().get(i)
                    : defaultName(i, setup.archetypes[i]);
            setup.startingHp[i] = checkStat(options.getStartingHp(i), "HP", i);
            setup.startingSp[i] = checkStat(options.getStartingSp(i), "SP", i);
        }
        return setup;
    }

    static String defaultName(int playerIndex, Archetype archetype) {
        return "Ai(" + (playerIndex + 1) + ")-" + StringUtils.capitalize(archetype.name().toLowerCase(Locale.ROOT));
    }

    private static Integer checkStat(Integer value, String stat, int playerIndex) {
        Preconditions.checkArgument(value == null || value >= 0,
                "Starting %s of player %s cannot be negative: %s", stat, playerIndex + 1, value);
        return value;
    }

    private static Archetype parseArchetype(String name) {
        try {
            return Archetype.fromName(name);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown character type '" + name + "'. Valid: "
                    + StringUtils.join(Archetype.values(), ", ").toLowerCase(Locale.ROOT), e);
        }
    }

    private static PlaystyleKind parsePlaystyle(String name) {
        try {
            return PlaystyleKind.fromName(name);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown playstyle '" + name + "'. Valid: "
                    + StringUtils.join(PlaystyleKind.values(), ", ").toLowerCase(Locale.ROOT), e);
        }
    }

    private static AiProfile loadProfile(String name) {
        if (StringUtils.isBlank(name)) {
            return AiProfile.defaults();
        }
        return AiProfile.load(name.trim());
    }

    /**
     * Creates a fresh queue holding both combatants, player 1 first.
     */
    public BattleQueue createBattle(Random random) {
        BattleQueue queue = restricted ? new RestrictedBattleQueue() : new BattleQueue();
        Combatant p1 = createCombatant(0, queue, random);
        Combatant p2 = createCombatant(1, queue, random);
        p1.setEnemy(p2);
        p2.setEnemy(p1);
        queue.add(p1);
        queue.add(p2);
        return queue;
    }

    private Combatant createCombatant(int index, BattleQueue queue, Random random) {
        Combatant c = archetypes[index].create(names[index], queue, playstyles[index].create(queue, profile, random));
        if (startingHp[index] != null) {
            c.setHp(startingHp[index]);
        }
        if (startingSp[index] != null) {
            c.setSp(startingSp[index]);
        }
        return c;
    }

    public Archetype getArchetype(int playerIndex) {
        return archetypes[playerIndex];
    }

    public String getName(int playerIndex) {
        return names[playerIndex];
    }

    public PlaystyleKind getPlaystyle(int playerIndex) {
        return playstyles[playerIndex];
    }

    public boolean isRestricted() {
        return restricted;
    }

    public AiProfile getProfile() {
        return profile;
    }

    @Override
    public String toString() {
        return names[0] + " [" + playstyles[0].name().toLowerCase(Locale.ROOT) + "] vs "
                + names[1] + " [" + playstyles[1].name().toLowerCase(Locale.ROOT) + "]"
                + (restricted ? " (restricted queue)" : "");
    }
}
