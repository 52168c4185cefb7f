package skirmish.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import skirmish.view.SimulateBattle;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Simulation subcommand for running computer vs computer battles.
 */
@Command(
    name = "sim",
    description = "Run computer vs computer battle simulation",
    mixinStandardHelpOptions = true,
    sortOptions = false
)
public class SimCommand implements Callable<Integer> {

    @Mixin
    private BattleOptions battle = new BattleOptions();

    @Option(
        names = {"-s", "--playstyle"},
        description = "Playstyle of a player: random, recursive or iterative. Give once per player. Default: recursive, recursive",
        paramLabel = "KIND"
    )
    private List<String> playstyles = new ArrayList<>();

    // === Game Configuration ===

    @Option(
        names = {"-n", "--games"},
        description = "Number of battles to simulate. Default: ${DEFAULT-VALUE}",
        defaultValue = "1",
        paramLabel = "N"
    )
    private int numGames;

    @Option(
        names = {"--seed"},
        description = "Seed for the random playstyle, for repeatable runs.",
        paramLabel = "SEED"
    )
    private Long seed;

    @Option(
        names = {"--list-profiles"},
        description = "List available AI profiles and exit."
    )
    private boolean listProfiles;

    // === Output Options ===

    @Option(
        names = {"-q", "--quiet"},
        description = "Suppress battle logs, only show battle results."
    )
    private boolean quiet;

    @Option(
        names = {"--json"},
        description = "Output results in JSON format with full battle logs to stdout."
    )
    private boolean jsonOutput;

    @Option(
        names = {"--csv"},
        description = "Output per-battle results in CSV format to stdout."
    )
    private boolean csvOutput;

    // === Getters ===

    public BattleOptions getBattle() {
        return battle;
    }

    public List<String> getPlaystyles() {
        return playstyles;
    }

    public int getNumGames() {
        return numGames;
    }

    public Long getSeed() {
        return seed;
    }

    public boolean isListProfiles() {
        return listProfiles;
    }

    public boolean isQuiet() {
        return quiet;
    }

    public boolean isJsonOutput() {
        return jsonOutput;
    }

    public boolean isCsvOutput() {
        return csvOutput;
    }

    @Override
    public Integer call() {
        if (listProfiles) {
            return SimulateBattle.listProfiles();
        }
        return SimulateBattle.simulate(this);
    }
}
