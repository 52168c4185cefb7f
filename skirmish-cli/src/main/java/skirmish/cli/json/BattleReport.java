package skirmish.cli.json;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON output model for simulation results.
 * This class and its nested classes are designed to be serialized with Gson.
 */
public class BattleReport {
    /** Skirmish version string */
    public String version;

    /** Configuration used for this simulation */
    public SimulationConfig config;

    /** Summary statistics */
    public SimulationSummary summary;

    /** Individual battle results */
    public List<BattleResult> battles = new ArrayList<>();

    /**
     * Configuration settings for the simulation.
     */
    public static class SimulationConfig {
        public List<String> characters = new ArrayList<>();
        public List<String> playstyles = new ArrayList<>();
        public boolean restrictedQueue;
        public int battlesRequested;
        public Long seed;
        public String aiProfile;
        public int maxTurns;
    }

    /**
     * Summary statistics for the simulation.
     */
    public static class SimulationSummary {
        public int totalBattles;
        public int draws;
        public long totalTimeMs;
        public double averageBattleTimeMs;
        public double battlesPerSecond;
        public List<PlayerSummary> players = new ArrayList<>();
    }

    /**
     * Per-player summary statistics.
     */
    public static class PlayerSummary {
        public int playerIndex;
        public String name;
        public String archetype;
        public String playstyle;
        public int wins;
        public int losses;
        public double winRate;
        public double winRateCiLower;
        public double winRateCiUpper;
    }

    /**
     * Results for a single battle.
     */
    public static class BattleResult {
        public int battleNumber;
        public boolean isDraw;
        public String winner;
        public Integer winnerIndex;
        public long durationMs;
        public int turns;
        public String endReason;
        public List<PlayerBattleResult> players = new ArrayList<>();
        /** Turn by turn log */
        public List<String> log;
    }

    /**
     * Per-player result for a single battle.
     */
    public static class PlayerBattleResult {
        public int playerIndex;
        public String name;
        public int finalHp;
        public int finalSp;
        public String outcome;
    }
}
