package skirmish.view;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.apache.commons.lang3.time.StopWatch;
import skirmish.ai.AiProfile;
import skirmish.ai.AiProps;
import skirmish.ai.simulation.TurnSimulator;
import skirmish.cli.ExitCode;
import skirmish.cli.ProgressBar;
import skirmish.cli.SimCommand;
import skirmish.cli.json.BattleReport;
import skirmish.cli.stats.WilsonInterval;
import skirmish.game.Action;
import skirmish.game.BattleQueue;
import skirmish.game.Combatant;
import skirmish.util.BuildInfo;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Runs battles between two computer players without any user interface.
 */
public final class SimulateBattle {

    /**
     * Why a battle stopped.
     */
    public enum EndReason {
        /** One or both players are down to 0 HP. */
        KNOCKOUT,
        /** Nobody can afford a move any more. */
        EXHAUSTED,
        /** The profile's turn limit was reached. */
        TURN_LIMIT,
        /** The player to move found no valid move. */
        NO_MOVE
    }

    /**
     * Outcome of a single battle.
     */
    public static class BattleResult {
        public int battleNumber;
        public boolean isDraw;
        public int winnerIndex = -1;
        public String winnerName;
        public int turns;
        public long timeMs;
        public EndReason endReason;
        public final int[] finalHp = new int[BattleSetup.PLAYERS];
        public final int[] finalSp = new int[BattleSetup.PLAYERS];
        public final List<String> log = new ArrayList<>();
    }

    private SimulateBattle() {
    }

    public static int listProfiles() {
        System.out.println("Available AI profiles:");
        System.out.println();
        for (String name : AiProfile.getAvailableProfiles()) {
            System.out.printf("  %s%n", name);
        }
        System.out.println();
        System.out.println("Usage: -P Exhaustive");
        return ExitCode.SUCCESS;
    }

    /**
     * Entry point for the {@code sim} command.
     * Diagnostics go to stderr, results to stdout.
     *
     * @return exit code (0 = success, non-zero = error)
     */
    public static int simulate(SimCommand cmd) {
        return simulate(cmd, System.out, System.err);
    }

    static int simulate(SimCommand cmd, PrintStream out, PrintStream err) {
        if (cmd.getNumGames() < 1) {
            err.println("Error: Number of games must be at least 1, got " + cmd.getNumGames());
            return ExitCode.ARGS_ERROR;
        }
        if (cmd.isJsonOutput() && cmd.isCsvOutput()) {
            err.println("Error: --json and --csv cannot be combined");
            return ExitCode.ARGS_ERROR;
        }

        BattleSetup setup;
        try {
            setup = BattleSetup.fromOptions(cmd.getBattle(), cmd.getPlaystyles());
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return ExitCode.SETUP_ERROR;
        }

        int nGames = cmd.getNumGames();
        boolean structuredOutput = cmd.isJsonOutput() || cmd.isCsvOutput();
        boolean outputLog = !cmd.isQuiet() && !structuredOutput;
        Random random = cmd.getSeed() != null ? new Random(cmd.getSeed()) : new Random();

        err.println("Simulation mode: " + setup);

        ProgressBar progress = cmd.isQuiet() && nGames > 1 ? new ProgressBar(err, nGames) : null;
        List<BattleResult> results = new ArrayList<>(nGames);
        StopWatch total = StopWatch.createStarted();
        for (int i = 0; i < nGames; i++) {
            BattleResult result = runBattle(setup, i + 1, random);
            results.add(result);

            if (outputLog) {
                for (String line : result.log) {
                    out.println(line);
                }
            }
            if (progress != null) {
                progress.increment();
            } else {
                // keep stdout clean for json/csv
                printResultLine(structuredOutput ? err : out, result);
            }
        }
        total.stop();
        if (progress != null) {
            progress.finish();
        }

        if (cmd.isJsonOutput()) {
            outputJsonResult(out, cmd, setup, results, total.getTime());
        } else if (cmd.isCsvOutput()) {
            outputCsvResult(out, setup, results);
        } else {
            outputSummary(out, setup, results, total.getTime());
        }
        out.flush();
        return ExitCode.SUCCESS;
    }

    /**
     * Plays one battle to the end. Player 1 moves first.
     */
    public static BattleResult runBattle(BattleSetup setup, int battleNumber, Random random) {
        BattleResult result = new BattleResult();
        result.battleNumber = battleNumber;

        BattleQueue queue = setup.createBattle(random);
        Combatant p1 = queue.getPlayer1();
        Combatant p2 = queue.getPlayer2();
        int maxTurns = setup.getProfile().getIntProperty(AiProps.MAX_TURNS);

        StopWatch sw = StopWatch.createStarted();
        EndReason reason = null;
        while (!queue.isOver()) {
            if (result.turns >= maxTurns) {
                reason = EndReason.TURN_LIMIT;
                break;
            }
            Combatant actor = queue.peek();
            Action action = actor.getPlaystyle().selectAction();
            if (action == Action.NONE) {
                reason = EndReason.NO_MOVE;
                break;
            }
            String skill = action == Action.ATTACK ? actor.getAttackSkill().getName() : actor.getSpecialSkill().getName();
            TurnSimulator.resolve(queue, action);
            result.turns++;
            result.log.add(String.format("Turn %d: %s uses %s. %s | %s", result.turns, actor.getName(), skill, p1, p2));
        }
        sw.stop();

        if (reason == null) {
            reason = p1.getHp() == 0 || p2.getHp() == 0 ? EndReason.KNOCKOUT : EndReason.EXHAUSTED;
        }
        result.endReason = reason;
        result.timeMs = sw.getTime();

        Combatant winner = reason == EndReason.KNOCKOUT ? queue.getWinner() : null;
        result.isDraw = winner == null;
        if (winner != null) {
            result.winnerName = winner.getName();
            result.winnerIndex = winner == p1 ? 0 : 1;
        }
        result.finalHp[0] = p1.getHp();
        result.finalHp[1] = p2.getHp();
        result.finalSp[0] = p1.getSp();
        result.finalSp[1] = p2.getSp();
        return result;
    }

    private static void printResultLine(PrintStream stream, BattleResult result) {
        if (result.isDraw) {
            stream.printf("Battle %d: Draw (%s) after %d turns (%d ms)%n",
                    result.battleNumber, result.endReason, result.turns, result.timeMs);
        } else {
            stream.printf("Battle %d: %s wins in %d turns (%d ms)%n",
                    result.battleNumber, result.winnerName, result.turns, result.timeMs);
        }
    }

    private static int[] countWins(List<BattleResult> results) {
        int[] wins = new int[BattleSetup.PLAYERS];
        for (BattleResult r : results) {
            if (!r.isDraw) {
                wins[r.winnerIndex]++;
            }
        }
        return wins;
    }

    private static int countDraws(List<BattleResult> results) {
        int draws = 0;
        for (BattleResult r : results) {
            if (r.isDraw) {
                draws++;
            }
        }
        return draws;
    }

    private static void outputSummary(PrintStream out, BattleSetup setup, List<BattleResult> results, long totalTime) {
        int n = results.size();
        int[] wins = countWins(results);
        int draws = countDraws(results);

        out.println();
        out.println("=== Simulation Summary ===");
        out.printf("Total battles: %d%n", n);
        for (int p = 0; p < BattleSetup.PLAYERS; p++) {
            out.printf("%s wins: %d (%s)%n", setup.getName(p), wins[p], WilsonInterval.forWins(wins[p], n));
        }
        out.printf("Draws: %d (%.1f%%)%n", draws, 100.0 * draws / n);
        out.printf("Total time: %d ms (%.1f ms/battle avg)%n", totalTime, (double) totalTime / n);
    }

    private static void outputJsonResult(PrintStream out, SimCommand cmd, BattleSetup setup,
                                         List<BattleResult> results, long totalTime) {
        BattleReport report = new BattleReport();
        report.version = BuildInfo.getVersionString();

        report.config = new BattleReport.SimulationConfig();
        for (int p = 0; p < BattleSetup.PLAYERS; p++) {
            report.config.characters.add(setup.getArchetype(p).name());
            report.config.playstyles.add(setup.getPlaystyle(p).name());
        }
        report.config.restrictedQueue = setup.isRestricted();
        report.config.battlesRequested = cmd.getNumGames();
        report.config.seed = cmd.getSeed();
        report.config.aiProfile = setup.getProfile().getName();
        report.config.maxTurns = setup.getProfile().getIntProperty(AiProps.MAX_TURNS);

        int n = results.size();
        int[] wins = countWins(results);
        int draws = countDraws(results);

        report.summary = new BattleReport.SimulationSummary();
        report.summary.totalBattles = n;
        report.summary.draws = draws;
        report.summary.totalTimeMs = totalTime;
        report.summary.averageBattleTimeMs = (double) totalTime / n;
        report.summary.battlesPerSecond = totalTime == 0 ? 0 : 1000.0 * n / totalTime;
        for (int p = 0; p < BattleSetup.PLAYERS; p++) {
            BattleReport.PlayerSummary ps = new BattleReport.PlayerSummary();
            ps.playerIndex = p;
            ps.name = setup.getName(p);
            ps.archetype = setup.getArchetype(p).name();
            ps.playstyle = setup.getPlaystyle(p).name();
            ps.wins = wins[p];
            ps.losses = n - wins[p] - draws;
            WilsonInterval ci = WilsonInterval.forWins(wins[p], n);
            ps.winRate = ci.getWinRate();
            ps.winRateCiLower = ci.getLower();
            ps.winRateCiUpper = ci.getUpper();
            report.summary.players.add(ps);
        }

        for (BattleResult r : results) {
            BattleReport.BattleResult br = new BattleReport.BattleResult();
            br.battleNumber = r.battleNumber;
            br.isDraw = r.isDraw;
            br.winner = r.winnerName;
            br.winnerIndex = r.isDraw ? null : r.winnerIndex;
            br.durationMs = r.timeMs;
            br.turns = r.turns;
            br.endReason = r.endReason.name();
            for (int p = 0; p < BattleSetup.PLAYERS; p++) {
                BattleReport.PlayerBattleResult pr = new BattleReport.PlayerBattleResult();
                pr.playerIndex = p;
                pr.name = setup.getName(p);
                pr.finalHp = r.finalHp[p];
                pr.finalSp = r.finalSp[p];
                pr.outcome = r.isDraw ? "draw" : r.winnerIndex == p ? "win" : "loss";
                br.players.add(pr);
            }
            br.log = r.log;
            report.battles.add(br);
        }

        Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .create();
        out.println(gson.toJson(report));
    }

    /**
     * Header row and one row per battle, then a per-player summary after a blank line.
     */
    private static void outputCsvResult(PrintStream out, BattleSetup setup, List<BattleResult> results) {
        out.println("battle,winner,winner_index,is_draw,turns,end_reason,p1_hp,p2_hp,duration_ms");
        for (BattleResult r : results) {
            out.printf("%d,%s,%s,%s,%d,%s,%d,%d,%d%n",
                    r.battleNumber,
                    r.isDraw ? "" : csvEscape(r.winnerName),
                    r.isDraw ? "" : String.valueOf(r.winnerIndex),
                    r.isDraw,
                    r.turns,
                    r.endReason,
                    r.finalHp[0],
                    r.finalHp[1],
                    r.timeMs);
        }

        out.println();
        out.println("player_index,name,archetype,playstyle,wins,losses,win_rate,ci_lower_95,ci_upper_95");
        int n = results.size();
        int[] wins = countWins(results);
        int draws = countDraws(results);
        for (int p = 0; p < BattleSetup.PLAYERS; p++) {
            WilsonInterval ci = WilsonInterval.forWins(wins[p], n);
            out.printf("%d,%s,%s,%s,%d,%d,%.1f,%.1f,%.1f%n",
                    p,
                    csvEscape(setup.getName(p)),
                    setup.getArchetype(p),
                    setup.getPlaystyle(p),
                    wins[p],
                    n - wins[p] - draws,
                    ci.getWinRate(),
                    ci.getLower(), ci.getUpper());
        }
    }

    /**
     * Quotes a CSV value if it contains commas, quotes or newlines.
     */
    static String csvEscape(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
