package skirmish.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import skirmish.view.ScoreOpening;

import java.util.concurrent.Callable;

/**
 * Scores an opening position and shows what the minimax players would do.
 */
@Command(
    name = "score",
    description = "Print the guaranteed score of an opening and the moves the minimax players pick",
    mixinStandardHelpOptions = true,
    sortOptions = false
)
public class ScoreCommand implements Callable<Integer> {

    @Mixin
    private BattleOptions battle = new BattleOptions();

    @Option(
        names = {"--iterative"},
        description = "Also run the iterative search. It builds the whole game tree, so keep HP low."
    )
    private boolean iterative;

    public BattleOptions getBattle() {
        return battle;
    }

    public boolean isIterative() {
        return iterative;
    }

    @Override
    public Integer call() {
        return ScoreOpening.score(this);
    }
}
