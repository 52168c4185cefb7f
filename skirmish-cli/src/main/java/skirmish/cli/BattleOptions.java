package skirmish.cli;

import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.List;

/**
 * Options describing the two combatants, shared by {@code sim} and {@code score}.
 */
public class BattleOptions {

    // === Combatants ===

    @Option(
        names = {"-c", "--character"},
        description = "Archetype of a combatant: rogue, mage, vampire or sorcerer. Give once per player. Default: rogue, mage",
        paramLabel = "TYPE"
    )
    private List<String> characters = new ArrayList<>();

    @Option(
        names = {"--name"},
        description = "Display name of a combatant. Give once per player.",
        paramLabel = "NAME"
    )
    private List<String> names = new ArrayList<>();

    @Option(
        names = {"--restricted"},
        description = "Use the restricted battle queue (limits how many turns a combatant can line up)."
    )
    private boolean restricted;

    // === Starting Stats ===

    @Option(names = {"--hp1"}, description = "Starting HP of player 1.", paramLabel = "HP")
    private Integer hp1;

    @Option(names = {"--hp2"}, description = "Starting HP of player 2.", paramLabel = "HP")
    private Integer hp2;

    @Option(names = {"--sp1"}, description = "Starting SP of player 1.", paramLabel = "SP")
    private Integer sp1;

    @Option(names = {"--sp2"}, description = "Starting SP of player 2.", paramLabel = "SP")
    private Integer sp2;

    // === AI Profile ===

    @Option(
        names = {"-P", "--profile"},
        description = "AI profile used by the computer players. Default: ${DEFAULT-VALUE}",
        defaultValue = "Default",
        paramLabel = "PROFILE"
    )
    private String profile;

    public List<String> getCharacters() {
        return characters;
    }

    public List<String> getNames() {
        return names;
    }

    public boolean isRestricted() {
        return restricted;
    }

    /**
     * Starting HP override for a player (0-indexed), or null to keep the default.
     */
    public Integer getStartingHp(int playerIndex) {
        return playerIndex == 0 ? hp1 : hp2;
    }

    /**
     * Starting SP override for a player (0-indexed), or null to keep the default.
     */
    public Integer getStartingSp(int playerIndex) {
        return playerIndex == 0 ? sp1 : sp2;
    }

    public String getProfile() {
        return profile;
    }
}
