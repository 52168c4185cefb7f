package skirmish.cli;

import java.io.PrintStream;

/**
 * Text progress bar for stderr, redrawn in place with a carriage return.
 */
public class ProgressBar {
    private static final int DEFAULT_WIDTH = 30;

    private final PrintStream out;
    private final int total;
    private final int barWidth;
    private final long startTime;
    private int current;

    public ProgressBar(PrintStream out, int total) {
        this(out, total, DEFAULT_WIDTH);
    }

    public ProgressBar(PrintStream out, int total, int barWidth) {
        this.out = out;
        this.total = total;
        this.barWidth = barWidth;
        this.startTime = System.currentTimeMillis();
    }

    public void increment() {
        current++;
        render();
    }

    private void render() {
        double fraction = total > 0 ? (double) current / total : 0;
        int filled = (int) (fraction * barWidth);

        StringBuilder bar = new StringBuilder(barWidth + 2).append('[');
        for (int i = 0; i < barWidth; i++) {
            bar.append(i < filled ? '#' : i == filled ? '>' : ' ');
        }
        bar.append(']');

        String eta = "--:--";
        if (current > 0) {
            long elapsed = System.currentTimeMillis() - startTime;
            eta = formatDuration((long) (elapsed * (total - current) / (double) current));
        }

        out.printf("\r%s %3.0f%% %d/%d  ETA: %s", bar, fraction * 100, current, total, eta);
        out.flush();
    }

    /**
     * Draws the full bar with the elapsed time and ends the line.
     */
    public void finish() {
        current = total;
        render();
        out.printf("  [%s]%n", formatDuration(System.currentTimeMillis() - startTime));
        out.flush();
    }

    static String formatDuration(long ms) {
        long secs = ms / 1000;
        if (secs < 3600) {
            return String.format("%d:%02d", secs / 60, secs % 60);
        }
        return String.format("%d:%02d:%02d", secs / 3600, (secs % 3600) / 60, secs % 60);
    }
}
