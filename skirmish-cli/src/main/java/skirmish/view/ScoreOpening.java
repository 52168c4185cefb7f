package skirmish.view;

import org.apache.commons.lang3.time.StopWatch;
import skirmish.ai.MinimaxIterativePlaystyle;
import skirmish.ai.MinimaxRecursivePlaystyle;
import skirmish.ai.simulation.StateScorer;
import skirmish.cli.ExitCode;
import skirmish.cli.ScoreCommand;
import skirmish.game.Action;
import skirmish.game.BattleQueue;

import java.io.PrintStream;
import java.util.Collections;
import java.util.Random;

/**
 * Scores the opening position of a battle with the minimax search.
 */
public final class ScoreOpening {

    private ScoreOpening() {
    }

    public static int score(ScoreCommand cmd) {
        return score(cmd, System.out, System.err);
    }

    static int score(ScoreCommand cmd, PrintStream out, PrintStream err) {
        BattleSetup setup;
        try {
            setup = BattleSetup.fromOptions(cmd.getBattle(), Collections.<String>emptyList());
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return ExitCode.SETUP_ERROR;
        }

        BattleQueue queue = setup.createBattle(new Random());
        out.println("Queue: " + queue);

        StateScorer scorer = StateScorer.fromProfile(setup.getProfile());
        StopWatch sw = StopWatch.createStarted();
        int score = scorer.scoreState(queue);
        sw.stop();
        out.printf("Score for %s: %d (%d positions, %d ms)%n",
                queue.peek().getName(), score, scorer.getNodesVisited(), sw.getTime());
        if (scorer.getTranspositionTable() != null) {
            out.println(scorer.getTranspositionTable().getStatsSummary());
        }

        MinimaxRecursivePlaystyle recursive = new MinimaxRecursivePlaystyle(queue, setup.getProfile());
        out.println("Recursive choice: " + recursive.selectAction());

        if (cmd.isIterative()) {
            MinimaxIterativePlaystyle iterative = new MinimaxIterativePlaystyle(queue);
            Action action = iterative.selectAction();
            out.printf("Iterative choice: %s (%d nodes)%n", action, iterative.getNodesBuilt());
        }
        return ExitCode.SUCCESS;
    }
}
