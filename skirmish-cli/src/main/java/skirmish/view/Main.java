/*
 * Skirmish: a turn-based duel engine.
 * Copyright (C) 2026  Skirmish Team
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package skirmish.view;

import io.sentry.Sentry;
import picocli.CommandLine;
import skirmish.cli.ExitCode;
import skirmish.cli.SkirmishCli;
import skirmish.util.BuildInfo;

/**
 * Command line entry point.
 */
public final class Main {

    public static void main(final String[] args) {
        // Error tracking; DSN comes from sentry.properties or the environment only
        Sentry.init(options -> {
            options.setEnableExternalConfiguration(true);
            options.setRelease(BuildInfo.getVersionString());
            options.setEnvironment(System.getProperty("os.name"));
            options.setTag("Java Version", System.getProperty("java.version"));
            options.setShutdownTimeoutMillis(5000);
            if (options.getDsn() == null) {
                options.setDsn("");
            }
        }, true);

        int exitCode = createCommandLine().execute(args);
        Sentry.close();
        System.exit(exitCode);
    }

    static CommandLine createCommandLine() {
        return new CommandLine(new SkirmishCli())
            .setExecutionExceptionHandler(new ExecutionExceptionHandler())
            .setParameterExceptionHandler(new ParameterExceptionHandler());
    }

    /**
     * Handle execution exceptions (runtime errors during command execution).
     */
    private static class ExecutionExceptionHandler implements CommandLine.IExecutionExceptionHandler {
        @Override
        public int handleExecutionException(Exception ex, CommandLine cmd,
                CommandLine.ParseResult parseResult) {
            Sentry.captureException(ex);
            System.err.println("Error: " + ex.getMessage());
            if (System.getProperty("skirmish.debug") != null) {
                ex.printStackTrace(System.err);
            }
            return ExitCode.RUNTIME_ERROR;
        }
    }

    /**
     * Handle parameter/parsing exceptions (invalid arguments).
     */
    private static class ParameterExceptionHandler implements CommandLine.IParameterExceptionHandler {
        @Override
        public int handleParseException(CommandLine.ParameterException ex, String[] args) {
            CommandLine cmd = ex.getCommandLine();
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            cmd.usage(System.err);
            return ExitCode.ARGS_ERROR;
        }
    }

    // Disallow instantiation
    private Main() {
    }
}
