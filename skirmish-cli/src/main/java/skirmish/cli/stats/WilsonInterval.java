package skirmish.cli.stats;

import com.google.common.base.Preconditions;

/**
 * A player's win rate over a run of battles, with its 95% Wilson score interval.
 * All values are percentages. The bounds stay inside [0, 100] even for a handful
 * of battles or a player that always wins or always loses.
 */
public final class WilsonInterval {

    private static final double Z_95 = 1.96;

    private final int wins;
    private final int battles;
    private final double lower;
    private final double upper;

    private WilsonInterval(int wins, int battles, double lower, double upper) {
        this.wins = wins;
        this.battles = battles;
        this.lower = lower;
        this.upper = upper;
    }

    /**
     * Interval for {@code wins} out of {@code battles}. With no battles nothing is
     * known and the interval spans everything.
     */
    public static WilsonInterval forWins(int wins, int battles) {
        Preconditions.checkArgument(battles >= 0 && wins >= 0 && wins <= battles,
                "%s wins out of %s battles", wins, battles);
        if (battles == 0) {
            return new WilsonInterval(0, 0, 0.0, 100.0);
        }

        double n = battles;
        double rate = wins / n;
        double zz = Z_95 * Z_95;
        double shrink = 1.0 + zz / n;
        double mid = (rate + zz / (2.0 * n)) / shrink;
        double halfWidth = Z_95 / shrink * Math.sqrt(rate * (1.0 - rate) / n + zz / (4.0 * n * n));
        return new WilsonInterval(wins, battles,
                100.0 * Math.max(0.0, mid - halfWidth),
                100.0 * Math.min(1.0, mid + halfWidth));
    }

    public int getWins() {
        return wins;
    }

    public int getBattles() {
        return battles;
    }

    public double getWinRate() {
        return battles == 0 ? 0.0 : 100.0 * wins / battles;
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    /**
     * E.g. {@code 52.3% [45.1%, 59.4%]}.
     */
    @Override
    public String toString() {
        return String.format("%.1f%% [%.1f%%, %.1f%%]", getWinRate(), lower, upper);
    }
}
