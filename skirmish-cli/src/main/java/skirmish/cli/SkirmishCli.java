package skirmish.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;
import skirmish.util.BuildInfo;

/**
 * Main CLI command for Skirmish.
 * Uses picocli for command-line parsing with proper help/version support.
 */
@Command(
    name = "skirmish",
    description = "Skirmish: turn-based duels between computer players",
    mixinStandardHelpOptions = true,
    versionProvider = SkirmishCli.VersionProvider.class,
    subcommands = {
        CommandLine.HelpCommand.class,
        SimCommand.class,
        ScoreCommand.class
    }
)
public class SkirmishCli implements Runnable {

    /**
     * When no subcommand is provided, show help.
     */
    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    /**
     * Provides dynamic version information from BuildInfo.
     */
    public static class VersionProvider implements IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[] {
                "Skirmish " + BuildInfo.getVersionString(),
                "Java: " + System.getProperty("java.version"),
                "OS: " + System.getProperty("os.name") + " " + System.getProperty("os.version")
            };
        }
    }
}
