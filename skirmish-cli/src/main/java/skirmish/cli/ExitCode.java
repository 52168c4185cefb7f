package skirmish.cli;

/**
 * Standard exit codes for the Skirmish CLI.
 * Following Unix conventions for exit status.
 */
public final class ExitCode {
    /** Successful execution */
    public static final int SUCCESS = 0;

    /** Invalid arguments or usage error */
    public static final int ARGS_ERROR = 1;

    /** Unknown archetype, playstyle or AI profile */
    public static final int SETUP_ERROR = 2;

    /** Runtime/execution error */
    public static final int RUNTIME_ERROR = 3;

    private ExitCode() {
        // Prevent instantiation
    }
}
